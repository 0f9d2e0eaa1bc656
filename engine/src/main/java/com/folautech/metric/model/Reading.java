package com.folautech.metric.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A single measured value. Identifiers and timestamp are optional and only carried through to alerts.
 */
@Value
@Builder
public class Reading {
    String readingId;
    String subjectId;
    @NonNull
    MetricKind metricKind;
    double value;
    LocalDateTime takenAt;

    public static Reading of(MetricKind metricKind, double value) {
        return Reading.builder()
            .metricKind(metricKind)
            .value(value)
            .build();
    }
}
