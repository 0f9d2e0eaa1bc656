package com.folautech.metric.registry;

import com.folautech.metric.exception.RegistryIntegrityException;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.Range;
import com.folautech.metric.model.ReferenceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only catalog of reference ranges keyed by metric kind.
 * <p>
 * Instances are validated when built and never change afterwards, so a single registry can be shared
 * by any number of threads. A kind without an entry is simply absent; it is not an error.
 */
public final class RangeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RangeRegistry.class);

    public static final String DEFAULT_RESOURCE = "metric-ranges.json";

    private final Map<MetricKind, ReferenceRange> ranges;

    private RangeRegistry(EnumMap<MetricKind, ReferenceRange> ranges) {
        this.ranges = Collections.unmodifiableMap(ranges);
    }

    /**
     * Registry built from the bundled clinical reference table.
     * @return the default registry
     * @throws RegistryIntegrityException if the bundled table is missing or inconsistent
     */
    public static RangeRegistry defaults() {
        return new RangeRegistryLoader().loadClasspath(DEFAULT_RESOURCE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ReferenceRange> lookup(MetricKind kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ranges.get(kind));
    }

    public Optional<ReferenceRange> lookup(String metricType) {
        return MetricKind.fromName(metricType).flatMap(this::lookup);
    }

    public boolean contains(MetricKind kind) {
        return kind != null && ranges.containsKey(kind);
    }

    public Set<MetricKind> kinds() {
        return ranges.keySet();
    }

    /**
     * @return all entries, in {@link MetricKind} declaration order
     */
    public Map<MetricKind, ReferenceRange> entries() {
        return ranges;
    }

    public int size() {
        return ranges.size();
    }

    public static final class Builder {

        private final EnumMap<MetricKind, ReferenceRange> ranges = new EnumMap<>(MetricKind.class);

        private Builder() {
        }

        public Builder normal(MetricKind kind, double min, double max) {
            return put(kind, ReferenceRange.of(Range.of(min, max)));
        }

        public Builder withCritical(MetricKind kind, double normalMin, double normalMax,
                                    double criticalMin, double criticalMax) {
            return put(kind, ReferenceRange.of(Range.of(normalMin, normalMax), Range.of(criticalMin, criticalMax)));
        }

        public Builder put(MetricKind kind, ReferenceRange range) {
            if (kind == null) {
                throw new RegistryIntegrityException("Metric kind is required");
            }
            if (range == null) {
                throw new RegistryIntegrityException("Reference range is required for " + kind);
            }
            if (ranges.containsKey(kind)) {
                throw new RegistryIntegrityException("Duplicate reference range for " + kind);
            }
            ranges.put(kind, range);
            return this;
        }

        public RangeRegistry build() {
            ranges.forEach(Builder::validate);
            logger.info("Range registry built with {} of {} metric kinds", ranges.size(), MetricKind.values().length);
            return new RangeRegistry(new EnumMap<>(ranges));
        }

        private static void validate(MetricKind kind, ReferenceRange range) {
            Range normal = range.getNormal();
            checkBand(kind, "normal", normal);
            range.getCritical().ifPresent(critical -> {
                checkBand(kind, "critical", critical);
                if (!critical.encloses(normal)) {
                    throw new RegistryIntegrityException(String.format(
                        "Critical band %s of %s does not contain normal band %s", critical, kind, normal));
                }
            });
        }

        private static void checkBand(MetricKind kind, String name, Range band) {
            if (!band.isFinite()) {
                throw new RegistryIntegrityException(String.format(
                    "%s band of %s must have finite bounds, got %s", name, kind, band));
            }
            if (band.getMin() > band.getMax()) {
                throw new RegistryIntegrityException(String.format(
                    "%s band of %s has min greater than max: %s", name, kind, band));
            }
        }
    }
}
