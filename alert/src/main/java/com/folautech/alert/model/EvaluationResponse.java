package com.folautech.alert.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Alerts produced from a batch of readings")
public class EvaluationResponse {

    @Schema(description = "Alerts in the order their readings were submitted")
    @Builder.Default
    private List<AlertResponse> alerts = List.of();

    @Schema(example = "1")
    private long criticalCount;

    @Schema(example = "1")
    private long abnormalCount;

    @Schema(description = "Readings that could not be classified (missing or non-finite value, bad timestamp)")
    @Builder.Default
    private List<ReadingIssue> rejected = List.of();

    @Schema(description = "Readings of metric types without reference data; treated as NORMAL")
    @Builder.Default
    private List<ReadingIssue> unrecognized = List.of();
}
