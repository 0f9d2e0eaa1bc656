package com.folautech.metric.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertTest {

    @Test
    @DisplayName("Alert cannot be NORMAL")
    void testNormalAlertRejected() {
        Reading reading = Reading.of(MetricKind.HEART_RATE, 75);

        assertThatThrownBy(() -> new Alert(reading, Severity.NORMAL, Range.of(60, 100)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Severity is ordered NORMAL < ABNORMAL < CRITICAL")
    void testSeverityOrder() {
        assertThat(Severity.CRITICAL.isMoreSevereThan(Severity.ABNORMAL)).isTrue();
        assertThat(Severity.ABNORMAL.isMoreSevereThan(Severity.NORMAL)).isTrue();
        assertThat(Severity.NORMAL.isMoreSevereThan(Severity.NORMAL)).isFalse();
        assertThat(Severity.NORMAL.requiresAttention()).isFalse();
    }

    @ParameterizedTest
    @DisplayName("Metric type names resolve case-insensitively")
    @CsvSource({
        "heart_rate, HEART_RATE",
        "' HbA1c ', HBA1C",
        "Blood_Glucose_Post_Meal, BLOOD_GLUCOSE_POST_MEAL"
    })
    void testFromName(String name, MetricKind expected) {
        assertThat(MetricKind.fromName(name)).contains(expected);
    }

    @Test
    @DisplayName("Unknown metric type names do not resolve")
    void testFromUnknownName() {
        assertThat(MetricKind.fromName("GLUCOSE")).isEmpty();
        assertThat(MetricKind.fromName(null)).isEmpty();
    }

    @Test
    @DisplayName("Range bounds are inclusive")
    void testRangeInclusive() {
        Range range = Range.of(36.1, 37.2);

        assertThat(range.contains(36.1)).isTrue();
        assertThat(range.contains(37.2)).isTrue();
        assertThat(range.contains(37.21)).isFalse();
        assertThat(Range.of(35, 39.5).encloses(range)).isTrue();
        assertThat(range.encloses(Range.of(35, 39.5))).isFalse();
    }
}
