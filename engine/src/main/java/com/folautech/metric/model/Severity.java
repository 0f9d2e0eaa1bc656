package com.folautech.metric.model;

/**
 * Classification tier of a reading. Declaration order is severity order.
 */
public enum Severity {
    NORMAL,
    ABNORMAL,
    CRITICAL;

    public boolean requiresAttention() {
        return this != NORMAL;
    }

    public boolean isMoreSevereThan(Severity other) {
        return compareTo(other) > 0;
    }
}
