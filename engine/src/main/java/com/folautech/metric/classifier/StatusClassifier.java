package com.folautech.metric.classifier;

import com.folautech.metric.exception.InvalidValueException;
import com.folautech.metric.model.Classification;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.Range;
import com.folautech.metric.model.ReferenceRange;
import com.folautech.metric.model.Severity;
import com.folautech.metric.registry.RangeRegistry;

import java.util.Objects;
import java.util.Optional;

/**
 * Classifies a single value of a metric kind against the registry's reference ranges.
 * Stateless; safe to share between threads.
 */
public class StatusClassifier {

    private final RangeRegistry registry;

    public StatusClassifier(RangeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Classify a value of a metric kind
     * @param kind metric kind
     * @param value measured value
     * @return full classification, {@code recognized=false} when the registry has no entry for the kind
     * @throws InvalidValueException if the value is NaN or infinite
     */
    public Classification evaluate(MetricKind kind, double value) {
        requireFinite(kind == null ? null : kind.name(), value);
        Optional<ReferenceRange> range = registry.lookup(kind);
        if (range.isEmpty()) {
            return Classification.unrecognized();
        }
        return classifyAgainst(range.get(), value);
    }

    /**
     * Name-based variant for callers holding a raw metric type. Unknown names classify as
     * NORMAL with {@code recognized=false}.
     */
    public Classification evaluate(String metricType, double value) {
        requireFinite(metricType, value);
        Optional<MetricKind> kind = MetricKind.fromName(metricType);
        if (kind.isEmpty()) {
            return Classification.unrecognized();
        }
        return evaluate(kind.get(), value);
    }

    public Severity classify(MetricKind kind, double value) {
        return evaluate(kind, value).getSeverity();
    }

    public Severity classify(String metricType, double value) {
        return evaluate(metricType, value).getSeverity();
    }

    public boolean isAbnormal(MetricKind kind, double value) {
        return classify(kind, value).requiresAttention();
    }

    public boolean isAbnormal(String metricType, double value) {
        return classify(metricType, value).requiresAttention();
    }

    // Critical is checked first so a value outside both bands is reported once, as CRITICAL.
    private static Classification classifyAgainst(ReferenceRange range, double value) {
        Optional<Range> critical = range.getCritical();
        if (critical.isPresent() && !critical.get().contains(value)) {
            return Classification.critical(critical.get());
        }
        if (!range.getNormal().contains(value)) {
            return Classification.abnormal(range.getNormal());
        }
        return Classification.normal();
    }

    private static void requireFinite(String metricType, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidValueException(metricType, value);
        }
    }
}
