package com.folautech.alert.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.folautech.metric.model.Alert;
import com.folautech.metric.model.Reading;
import com.folautech.metric.model.Severity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Reading that needs clinical attention")
public class AlertResponse {

    @Schema(example = "22222222-2222-2222-2222-222222222222")
    private String readingId;

    @Schema(example = "p-001")
    private String patientId;

    @Schema(example = "HEART_RATE")
    private String metricType;

    @Schema(example = "bpm")
    private String unit;

    @Schema(example = "35")
    private double value;

    @Schema(description = "ABNORMAL or CRITICAL", example = "CRITICAL")
    private Severity severity;

    @Schema(description = "Critical band when the reading is CRITICAL, otherwise the normal band")
    private BandResponse violatedRange;

    private LocalDateTime takenAt;

    public static AlertResponse from(Alert alert) {
        Reading reading = alert.getReading();
        return AlertResponse.builder()
            .readingId(reading.getReadingId())
            .patientId(reading.getSubjectId())
            .metricType(reading.getMetricKind().name())
            .unit(reading.getMetricKind().getUnit())
            .value(reading.getValue())
            .severity(alert.getSeverity())
            .violatedRange(BandResponse.from(alert.getViolatedRange()))
            .takenAt(reading.getTakenAt())
            .build();
    }
}
