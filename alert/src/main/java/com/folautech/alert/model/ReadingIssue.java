package com.folautech.alert.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A reading that was not turned into an alert because it could not be judged")
public class ReadingIssue {

    public static final String UNKNOWN_METRIC_TYPE = "UNKNOWN_METRIC_TYPE";
    public static final String NO_REFERENCE_RANGE = "NO_REFERENCE_RANGE";
    public static final String MISSING_VALUE = "MISSING_VALUE";
    public static final String INVALID_TIMESTAMP = "INVALID_TIMESTAMP";

    @Schema(description = "Position of the reading in the submitted batch", example = "1")
    private int index;

    private String readingId;

    @Schema(example = "PULSE_PRESSURE")
    private String metricType;

    @Schema(example = "UNKNOWN_METRIC_TYPE")
    private String code;

    @Schema(example = "Unknown metric type: PULSE_PRESSURE")
    private String reason;
}
