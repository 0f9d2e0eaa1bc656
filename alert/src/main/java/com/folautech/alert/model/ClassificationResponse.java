package com.folautech.alert.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.folautech.metric.model.Severity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Severity of a single value")
public class ClassificationResponse {

    @Schema(example = "HEART_RATE")
    private String metricType;

    @Schema(example = "110")
    private double value;

    @Schema(example = "ABNORMAL")
    private Severity severity;

    @Schema(description = "False when no reference range exists for the metric type; severity is then NORMAL")
    private boolean recognized;

    private BandResponse violatedRange;
}
