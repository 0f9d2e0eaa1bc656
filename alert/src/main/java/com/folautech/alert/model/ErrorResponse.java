package com.folautech.alert.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @Schema(description = "Error message", example = "Value for HEART_RATE must be a finite number, got NaN")
    private String message;

    @Schema(description = "HTTP status code", example = "400")
    private int status;

    @Schema(description = "Machine-readable error code", example = "INVALID_VALUE")
    private String code;

    @Schema(description = "Timestamp of the error", example = "2025-08-01T12:00:00Z")
    private String timestamp;

    @Schema(description = "Request path", example = "/classify")
    private String path;
}
