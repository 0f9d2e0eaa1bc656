package com.folautech.metric.exception;

import com.folautech.metric.model.MetricKind;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown when a value cannot be classified because it is NaN or infinite.
 */
public class InvalidValueException extends MetricEngineException {

    public InvalidValueException(String metricType, double value) {
        super(ErrorCode.INVALID_VALUE,
            String.format("Value for %s must be a finite number, got %s", metricType, value),
            details(metricType, value));
    }

    public InvalidValueException(MetricKind kind, double value) {
        this(kind.name(), value);
    }

    private static Map<String, Object> details(String metricType, double value) {
        // Map.of rejects null keys/values; metricType may be null for unnamed callers
        Map<String, Object> details = new HashMap<>();
        details.put("metricType", metricType);
        details.put("value", String.valueOf(value));
        return details;
    }
}
