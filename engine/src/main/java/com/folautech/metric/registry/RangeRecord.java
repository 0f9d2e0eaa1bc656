package com.folautech.metric.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the declarative reference table:
 * {@code {"kind": "HEART_RATE", "normalMin": 60, "normalMax": 100, "criticalMin": 40, "criticalMax": 150}}.
 * The critical bounds are either both present or both absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RangeRecord {
    private String kind;
    private Double normalMin;
    private Double normalMax;
    private Double criticalMin;
    private Double criticalMax;

    public RangeRecord(String kind, Double normalMin, Double normalMax) {
        this(kind, normalMin, normalMax, null, null);
    }
}
