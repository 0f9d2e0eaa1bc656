package com.folautech.metric.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of classifying one value: the tier, whether reference data existed for the kind,
 * and the band that was violated when the tier is not NORMAL.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Classification {

    private static final Classification UNRECOGNIZED = new Classification(Severity.NORMAL, false, null);
    private static final Classification WITHIN_RANGE = new Classification(Severity.NORMAL, true, null);

    private final Severity severity;
    private final boolean recognized;

    @Getter(AccessLevel.NONE)
    private final Range violatedRange;

    public static Classification unrecognized() {
        return UNRECOGNIZED;
    }

    public static Classification normal() {
        return WITHIN_RANGE;
    }

    public static Classification abnormal(Range violatedNormal) {
        return new Classification(Severity.ABNORMAL, true, violatedNormal);
    }

    public static Classification critical(Range violatedCritical) {
        return new Classification(Severity.CRITICAL, true, violatedCritical);
    }

    public Optional<Range> getViolatedRange() {
        return Optional.ofNullable(violatedRange);
    }

    public boolean isAbnormal() {
        return severity.requiresAttention();
    }
}
