package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ContextualAnalysis;
import org.junit.jupiter.api.Test;

import static com.elssolution.greenguard.service.ContextualAnalyzer.*;
import static com.elssolution.greenguard.service.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ContextualAnalyzerTest {

    private final ContextualAnalyzer analyzer = new ContextualAnalyzer();

    @Test
    void normal_load_in_normal_weather_is_not_suspicious() {
        ContextualAnalysis a = analyzer.analyze(reading(200), context(28, "Clear", 500), ahmedabad());

        assertThat(a.suspicious()).isFalse();
        assertThat(a.flags()).isEmpty();
        assertThat(a.reasoning()).isEqualTo(DEFAULT_REASONING);
    }

    @Test
    void high_load_on_a_cool_day_is_suspicious() {
        ContextualAnalysis a = analyzer.analyze(reading(300), context(18, "Cloudy", 500), ahmedabad());

        assertThat(a.suspicious()).isTrue();
        assertThat(a.flags()).containsExactly(HIGH_ENERGY_COOL_WEATHER);
    }

    @Test
    void dirty_grid_alone_only_flags() {
        ContextualAnalysis a = analyzer.analyze(reading(320), context(30, "Clear", 850), ahmedabad());

        assertThat(a.suspicious()).isFalse();
        assertThat(a.flags()).containsExactly(HIGH_CARBON_IMPACT);
        assertThat(a.reasoning()).contains("carbon-intensive");
    }

    @Test
    void critical_overage_overrides_earlier_reasoning() {
        ContextualAnalysis a = analyzer.analyze(reading(450), context(15, "Clear", 900), ahmedabad());

        assertThat(a.suspicious()).isTrue();
        assertThat(a.flags()).containsExactly(HIGH_ENERGY_COOL_WEATHER, HIGH_CARBON_IMPACT, CRITICAL_OVERAGE);
        assertThat(a.reasoning()).startsWith("Critical overage");
    }

    @Test
    void extreme_heat_explains_high_load() {
        ContextualAnalysis a = analyzer.analyze(reading(320), context(38, "Rain", 400), ahmedabad());

        assertThat(a.suspicious()).isFalse();
        assertThat(a.flags()).containsExactly(EXTREME_HEAT_HIGH_LOAD, HIGH_LOAD_RAINY_DAY);
        assertThat(a.reasoning()).contains("expected");
    }

    @Test
    void rainy_day_near_peak_is_suspicious() {
        ContextualAnalysis a = analyzer.analyze(reading(320), context(26, "rain", 400), ahmedabad());

        assertThat(a.suspicious()).isTrue();
        assertThat(a.flags()).containsExactly(HIGH_LOAD_RAINY_DAY);
        assertThat(a.reasoning()).contains("rainy day");
    }
}
