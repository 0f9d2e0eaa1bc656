package com.folautech.metric.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * Normal band of a metric kind, plus the wider critical band when one is defined.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReferenceRange {

    @Getter
    private final Range normal;

    private final Range critical;

    public static ReferenceRange of(Range normal) {
        return new ReferenceRange(Objects.requireNonNull(normal, "normal"), null);
    }

    public static ReferenceRange of(Range normal, Range critical) {
        return new ReferenceRange(Objects.requireNonNull(normal, "normal"), critical);
    }

    public Optional<Range> getCritical() {
        return Optional.ofNullable(critical);
    }

    @Override
    public String toString() {
        return critical == null
            ? "normal=" + normal
            : "normal=" + normal + ", critical=" + critical;
    }
}
