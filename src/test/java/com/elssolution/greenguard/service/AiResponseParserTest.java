package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.domain.VerdictSource;
import com.elssolution.greenguard.service.AiResponseParser.MalformedAiResponseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiResponseParserTest {

    private final AiResponseParser parser = new AiResponseParser();

    @Test
    void parses_plain_json() {
        ClassifierVerdict v = parser.parse("{\"severity\":\"WARNING\",\"confidence\":72,\"reasoning\":\"Close to ceiling\"}");

        assertThat(v.severity()).isEqualTo(Severity.WARNING);
        assertThat(v.confidence()).isEqualTo(72);
        assertThat(v.reasoning()).isEqualTo("Close to ceiling");
        assertThat(v.source()).isEqualTo(VerdictSource.AI_PRIMARY);
    }

    @Test
    void tolerates_code_fence_and_lowercase_label() {
        String raw = "```json\n{\"severity\": \"anomaly\", \"confidence\": 91.6, \"reasoning\": \"Way over\"}\n```";

        ClassifierVerdict v = parser.parse(raw);

        assertThat(v.severity()).isEqualTo(Severity.ANOMALY);
        assertThat(v.confidence()).isEqualTo(92);
    }

    @Test
    void normal_label_maps_to_verified_and_confidence_is_clamped() {
        ClassifierVerdict v = parser.parse("{\"severity\":\"Normal\",\"confidence\":140,\"reasoning\":\"ok\"}");

        assertThat(v.severity()).isEqualTo(Severity.VERIFIED);
        assertThat(v.confidence()).isEqualTo(100);
        assertThat(parser.parse("{\"severity\":\"WARNING\",\"confidence\":4294967346,\"reasoning\":\"ok\"}").confidence())
                .isEqualTo(100);
        assertThat(parser.parse("{\"severity\":\"WARNING\",\"confidence\":1e19,\"reasoning\":\"ok\"}").confidence())
                .isEqualTo(100);
        assertThat(parser.parse("{\"severity\":\"WARNING\",\"confidence\":-4294967346,\"reasoning\":\"ok\"}").confidence())
                .isZero();
    }

    @Test
    void reviewer_states_are_not_verdicts() {
        assertThatThrownBy(() -> parser.parse("{\"severity\":\"PENDING\",\"confidence\":50,\"reasoning\":\"?\"}"))
                .isInstanceOf(MalformedAiResponseException.class);
    }

    @Test
    void missing_or_bad_fields_are_rejected() {
        assertThatThrownBy(() -> parser.parse("{\"severity\":\"WARNING\",\"reasoning\":\"x\"}"))
                .isInstanceOf(MalformedAiResponseException.class);
        assertThatThrownBy(() -> parser.parse("{\"severity\":\"WARNING\",\"confidence\":\"high\",\"reasoning\":\"x\"}"))
                .isInstanceOf(MalformedAiResponseException.class);
        assertThatThrownBy(() -> parser.parse("{\"severity\":\"WARNING\",\"confidence\":50,\"reasoning\":\" \"}"))
                .isInstanceOf(MalformedAiResponseException.class);
        assertThatThrownBy(() -> parser.parse("The reading looks fine to me."))
                .isInstanceOf(MalformedAiResponseException.class);
        assertThatThrownBy(() -> parser.parse("[1,2]"))
                .isInstanceOf(MalformedAiResponseException.class);
    }
}
