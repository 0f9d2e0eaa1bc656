package com.folautech.metric.model;

import lombok.Value;

/**
 * Inclusive band {@code [min, max]}.
 */
@Value
public class Range {
    double min;
    double max;

    public static Range of(double min, double max) {
        return new Range(min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public boolean encloses(Range other) {
        return min <= other.min && other.max <= max;
    }

    public boolean isFinite() {
        return Double.isFinite(min) && Double.isFinite(max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
