package com.folautech.alert.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.ReferenceRange;
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
@Schema(description = "Reference ranges of one metric type")
public class RangeResponse {

    @Schema(example = "HEART_RATE")
    private String metricType;

    @Schema(example = "Heart Rate")
    private String label;

    @Schema(example = "bpm")
    private String unit;

    private BandResponse normal;

    @Schema(description = "Absent when the metric type has no critical band")
    private BandResponse critical;

    public static RangeResponse from(MetricKind kind, ReferenceRange range) {
        return RangeResponse.builder()
            .metricType(kind.name())
            .label(kind.getLabel())
            .unit(kind.getUnit())
            .normal(BandResponse.from(range.getNormal()))
            .critical(range.getCritical().map(BandResponse::from).orElse(null))
            .build();
    }
}
