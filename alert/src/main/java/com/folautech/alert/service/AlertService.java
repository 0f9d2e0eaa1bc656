package com.folautech.alert.service;

import com.folautech.alert.model.AlertResponse;
import com.folautech.alert.model.BandResponse;
import com.folautech.alert.model.ClassificationResponse;
import com.folautech.alert.model.EvaluationResponse;
import com.folautech.alert.model.RangeResponse;
import com.folautech.alert.model.ReadingIssue;
import com.folautech.alert.model.ReadingRequest;
import com.folautech.metric.aggregator.AlertAggregator;
import com.folautech.metric.aggregator.AlertReport;
import com.folautech.metric.aggregator.RejectedReading;
import com.folautech.metric.classifier.StatusClassifier;
import com.folautech.metric.model.Classification;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.Reading;
import com.folautech.metric.registry.RangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class AlertService {

    private static final Logger logger = LoggerFactory.getLogger(AlertService.class);

    private final RangeRegistry rangeRegistry;
    private final StatusClassifier statusClassifier;
    private final AlertAggregator alertAggregator;

    public AlertService(RangeRegistry rangeRegistry, StatusClassifier statusClassifier, AlertAggregator alertAggregator) {
        this.rangeRegistry = rangeRegistry;
        this.statusClassifier = statusClassifier;
        this.alertAggregator = alertAggregator;
    }

    /**
     * Evaluate a list of readings
     * @param readings List of readings to evaluate
     * @return Mono<EvaluationResponse> alerts in submission order, plus readings that could not be judged
     */
    public Mono<EvaluationResponse> evaluateReadings(List<ReadingRequest> readings) {
        return Mono.fromCallable(() -> evaluate(readings == null ? List.of() : readings));
    }

    private EvaluationResponse evaluate(List<ReadingRequest> requests) {
        logger.info("Evaluating {} readings", requests.size());

        List<Reading> readings = new ArrayList<>(requests.size());
        Map<Reading, Integer> positions = new IdentityHashMap<>();
        List<ReadingIssue> rejected = new ArrayList<>();
        List<ReadingIssue> unrecognized = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            ReadingRequest request = requests.get(i);
            if (request == null) {
                rejected.add(new ReadingIssue(i, null, null, ReadingIssue.MISSING_VALUE, "Reading is empty"));
                continue;
            }
            logger.debug("Evaluating reading: type={}, patientId={}, readingId={}",
                request.getMetricType(), request.getPatientId(), request.getReadingId());

            Optional<MetricKind> kind = MetricKind.fromName(request.getMetricType());
            if (kind.isEmpty()) {
                logger.warn("Unknown metric type {} for reading {}", request.getMetricType(), request.getReadingId());
                unrecognized.add(issue(i, request, ReadingIssue.UNKNOWN_METRIC_TYPE,
                    "Unknown metric type: " + request.getMetricType()));
                continue;
            }
            if (request.getValue() == null) {
                rejected.add(issue(i, request, ReadingIssue.MISSING_VALUE, "value is required"));
                continue;
            }
            LocalDateTime takenAt;
            try {
                takenAt = parseDateTime(request.getTakenAt());
            } catch (DateTimeParseException e) {
                rejected.add(issue(i, request, ReadingIssue.INVALID_TIMESTAMP,
                    "takenAt is not an ISO local date-time: " + request.getTakenAt()));
                continue;
            }

            Reading reading = Reading.builder()
                .readingId(request.getReadingId())
                .subjectId(request.getPatientId())
                .metricKind(kind.get())
                .value(request.getValue())
                .takenAt(takenAt)
                .build();
            readings.add(reading);
            positions.put(reading, i);
        }

        AlertReport report = alertAggregator.evaluate(readings);

        for (RejectedReading item : report.getRejected()) {
            rejected.add(issue(positions.get(item.getReading()), item.getReading(),
                item.getErrorCode().getCode(), item.getReason()));
        }
        for (Reading reading : report.getUnrecognized()) {
            unrecognized.add(issue(positions.get(reading), reading, ReadingIssue.NO_REFERENCE_RANGE,
                "No reference range for " + reading.getMetricKind()));
        }
        rejected.sort(Comparator.comparingInt(ReadingIssue::getIndex));
        unrecognized.sort(Comparator.comparingInt(ReadingIssue::getIndex));

        if (!rejected.isEmpty() || !unrecognized.isEmpty()) {
            logger.warn("{} readings rejected and {} unrecognized out of {}",
                rejected.size(), unrecognized.size(), requests.size());
        }

        List<AlertResponse> alerts = report.getAlerts().stream()
            .map(AlertResponse::from)
            .toList();

        return EvaluationResponse.builder()
            .alerts(alerts)
            .criticalCount(report.getCriticalCount())
            .abnormalCount(report.getAbnormalCount())
            .rejected(rejected)
            .unrecognized(unrecognized)
            .build();
    }

    public Mono<ClassificationResponse> classify(String metricType, double value) {
        return Mono.fromCallable(() -> {
            Classification classification = statusClassifier.evaluate(metricType, value);
            if (!classification.isRecognized()) {
                logger.warn("No reference range for metric type {}, classified as NORMAL", metricType);
            }
            return ClassificationResponse.builder()
                .metricType(metricType)
                .value(value)
                .severity(classification.getSeverity())
                .recognized(classification.isRecognized())
                .violatedRange(classification.getViolatedRange().map(BandResponse::from).orElse(null))
                .build();
        });
    }

    public Flux<RangeResponse> getRanges() {
        return Flux.fromIterable(rangeRegistry.entries().entrySet())
            .map(entry -> RangeResponse.from(entry.getKey(), entry.getValue()));
    }

    public Mono<RangeResponse> getRange(String metricType) {
        return Mono.justOrEmpty(MetricKind.fromName(metricType))
            .flatMap(kind -> Mono.justOrEmpty(rangeRegistry.lookup(kind))
                .map(range -> RangeResponse.from(kind, range)))
            .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                "No reference range for metric type: " + metricType)));
    }

    private static ReadingIssue issue(int index, ReadingRequest request, String code, String reason) {
        return new ReadingIssue(index, request.getReadingId(), request.getMetricType(), code, reason);
    }

    private static ReadingIssue issue(int index, Reading reading, String code, String reason) {
        return new ReadingIssue(index, reading.getReadingId(), reading.getMetricKind().name(), code, reason);
    }

    // Offsets are refused rather than dropped, so a zoned time is never read as local.
    private static LocalDateTime parseDateTime(String dateTimeStr) {
        if (dateTimeStr == null || dateTimeStr.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(dateTimeStr, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
