package com.folautech.metric.exception;

import java.util.Map;

/**
 * Thrown while building a range registry from authored data that is inconsistent or unreadable.
 */
public class RegistryIntegrityException extends MetricEngineException {

    public RegistryIntegrityException(String message) {
        super(ErrorCode.REGISTRY_INTEGRITY, message, Map.of());
    }

    public RegistryIntegrityException(String message, Throwable cause) {
        super(ErrorCode.REGISTRY_INTEGRITY, message, cause);
    }
}
