package com.folautech.metric.aggregator;

import com.folautech.metric.classifier.StatusClassifier;
import com.folautech.metric.exception.ErrorCode;
import com.folautech.metric.exception.MetricEngineException;
import com.folautech.metric.model.Alert;
import com.folautech.metric.model.Classification;
import com.folautech.metric.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a batch of readings into the alerts that need clinical attention.
 * <p>
 * Alerts keep the order of the input; the aggregator never sorts, truncates or deduplicates.
 * A reading that cannot be classified is skipped and reported without affecting the rest of the batch.
 */
public class AlertAggregator {

    private static final Logger logger = LoggerFactory.getLogger(AlertAggregator.class);

    private final StatusClassifier classifier;

    public AlertAggregator(StatusClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Evaluate a list of readings
     * @param readings readings to evaluate, in the order alerts should be returned
     * @return alerts for ABNORMAL and CRITICAL readings
     */
    public List<Alert> aggregate(List<Reading> readings) {
        return evaluate(readings).getAlerts();
    }

    /**
     * Evaluate a list of readings and report the ones that were rejected or unrecognized
     * alongside the alerts.
     */
    public AlertReport evaluate(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            return AlertReport.empty();
        }
        logger.debug("Evaluating {} readings", readings.size());

        List<Alert> alerts = new ArrayList<>();
        List<RejectedReading> rejected = new ArrayList<>();
        List<Reading> unrecognized = new ArrayList<>();

        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            if (reading == null) {
                logger.warn("Rejected null reading at position {}", i);
                rejected.add(new RejectedReading(i, null, ErrorCode.MISSING_READING, "Reading is null"));
                continue;
            }
            Classification classification;
            try {
                classification = classifier.evaluate(reading.getMetricKind(), reading.getValue());
            } catch (MetricEngineException e) {
                logger.warn("Rejected reading {} ({}): {}",
                    reading.getReadingId(), reading.getMetricKind(), e.getMessage());
                rejected.add(new RejectedReading(i, reading, e.getErrorCode(), e.getMessage()));
                continue;
            }

            if (!classification.isRecognized()) {
                logger.warn("No reference range for {}, reading {} treated as NORMAL",
                    reading.getMetricKind(), reading.getReadingId());
                unrecognized.add(reading);
                continue;
            }
            if (!classification.isAbnormal()) {
                continue;
            }

            Alert alert = new Alert(reading, classification.getSeverity(),
                classification.getViolatedRange().orElseThrow());
            logger.debug("Alert for reading {}: {} {} outside {}", reading.getReadingId(),
                reading.getMetricKind(), alert.getSeverity(), alert.getViolatedRange());
            alerts.add(alert);
        }

        logger.info("Evaluated {} readings: {} alerts, {} rejected, {} unrecognized",
            readings.size(), alerts.size(), rejected.size(), unrecognized.size());
        return new AlertReport(alerts, rejected, unrecognized);
    }
}
