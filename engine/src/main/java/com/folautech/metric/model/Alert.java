package com.folautech.metric.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

/**
 * A reading that needs clinical attention, with the tier it was given and the band it fell outside of.
 */
@Value
public class Alert {

    /**
     * Most severe first; ties keep their relative order when used with a stable sort.
     */
    public static final Comparator<Alert> BY_SEVERITY_DESC =
        Comparator.comparing(Alert::getSeverity, Comparator.reverseOrder());

    @NonNull
    Reading reading;
    @NonNull
    Severity severity;
    @NonNull
    Range violatedRange;

    public Alert(@NonNull Reading reading, @NonNull Severity severity, @NonNull Range violatedRange) {
        if (!severity.requiresAttention()) {
            throw new IllegalArgumentException("Alert severity must be ABNORMAL or CRITICAL, got " + severity);
        }
        this.reading = reading;
        this.severity = severity;
        this.violatedRange = violatedRange;
    }

    public MetricKind getMetricKind() {
        return reading.getMetricKind();
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
