package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.Maths;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.domain.VerdictSource;
import com.elssolution.greenguard.integration.HttpSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict reader for the model's JSON answer. Anything it can't fully trust is rejected
 * with {@link MalformedAiResponseException}.
 */
@Component
public class AiResponseParser {

    static final int MAX_REASONING_CHARS = 500;

    private static final Pattern FENCED = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ObjectMapper om = new ObjectMapper();

    public ClassifierVerdict parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedAiResponseException("empty response");
        }
        String body = raw.trim();
        Matcher m = FENCED.matcher(body);
        if (m.matches()) body = m.group(1);

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedAiResponseException("not JSON: " + HttpSupport.truncate(body, 120));
        }
        if (root == null || !root.isObject()) {
            throw new MalformedAiResponseException("expected a JSON object");
        }

        JsonNode sevNode = root.path("severity");
        Severity severity = Severity.fromLabel(sevNode.isTextual() ? sevNode.asText() : null)
                .orElseThrow(() -> new MalformedAiResponseException("unknown severity label: " + sevNode));

        JsonNode confNode = root.path("confidence");
        if (!confNode.isNumber() || !Double.isFinite(confNode.asDouble())) {
            throw new MalformedAiResponseException("confidence missing or not numeric: " + confNode);
        }
        int confidence = (int) Math.round(Maths.clamp(confNode.asDouble(), 0, 100));

        JsonNode reasonNode = root.path("reasoning");
        if (!reasonNode.isTextual() || reasonNode.asText().isBlank()) {
            throw new MalformedAiResponseException("reasoning missing");
        }
        String reasoning = reasonNode.asText().trim();
        if (reasoning.length() > MAX_REASONING_CHARS) reasoning = reasoning.substring(0, MAX_REASONING_CHARS);

        return new ClassifierVerdict(severity, confidence, reasoning, VerdictSource.AI_PRIMARY);
    }

    public static class MalformedAiResponseException extends RuntimeException {
        public MalformedAiResponseException(String message) {
            super(message);
        }
    }
}
