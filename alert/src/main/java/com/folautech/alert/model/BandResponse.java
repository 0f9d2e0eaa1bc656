package com.folautech.alert.model;

import com.folautech.metric.model.Range;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inclusive value band")
public class BandResponse {

    @Schema(example = "60")
    private double min;

    @Schema(example = "100")
    private double max;

    public static BandResponse from(Range range) {
        return range == null ? null : new BandResponse(range.getMin(), range.getMax());
    }
}
