package com.folautech.metric.aggregator;

import com.folautech.metric.model.Alert;
import com.folautech.metric.model.Reading;
import com.folautech.metric.model.Severity;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating a batch of readings. Alerts are in input order.
 */
@Value
public class AlertReport {

    private static final AlertReport EMPTY = new AlertReport(List.of(), List.of(), List.of());

    List<Alert> alerts;
    List<RejectedReading> rejected;
    List<Reading> unrecognized;

    public AlertReport(List<Alert> alerts, List<RejectedReading> rejected, List<Reading> unrecognized) {
        this.alerts = List.copyOf(alerts);
        this.rejected = List.copyOf(rejected);
        this.unrecognized = List.copyOf(unrecognized);
    }

    public static AlertReport empty() {
        return EMPTY;
    }

    /**
     * @return number of alerts per severity; NORMAL is always zero
     */
    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        alerts.forEach(alert -> counts.merge(alert.getSeverity(), 1L, Long::sum));
        return Collections.unmodifiableMap(counts);
    }

    public long getCriticalCount() {
        return alerts.stream().filter(Alert::isCritical).count();
    }

    public long getAbnormalCount() {
        return alerts.stream().filter(alert -> alert.getSeverity() == Severity.ABNORMAL).count();
    }

    public boolean hasAlerts() {
        return !alerts.isEmpty();
    }
}
