package com.folautech.alert.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Health metric reading submitted for evaluation")
public class ReadingRequest {

    @Schema(description = "Caller's identifier for the reading", example = "11111111-1111-1111-1111-111111111111")
    private String readingId;

    @Schema(description = "Patient identifier", example = "p-001")
    private String patientId;

    @Schema(description = "Metric type", example = "HEART_RATE")
    private String metricType;

    @Schema(description = "Measured value in the metric's unit", example = "110")
    private Double value;

    @Schema(description = "Local time the reading was taken, ISO-8601 without offset", example = "2025-08-01T12:00:00")
    private String takenAt;
}
