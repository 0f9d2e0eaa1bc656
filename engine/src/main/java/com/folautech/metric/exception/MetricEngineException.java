package com.folautech.metric.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public abstract class MetricEngineException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected MetricEngineException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected MetricEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
