package com.folautech.alert.controller;

import com.folautech.alert.model.ClassificationResponse;
import com.folautech.alert.model.ErrorResponse;
import com.folautech.alert.model.EvaluationResponse;
import com.folautech.alert.model.RangeResponse;
import com.folautech.alert.model.ReadingRequest;
import com.folautech.alert.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Alert Evaluation", description = "API for classifying health metric readings against reference ranges")
public class AlertController {

    private static final Logger logger = LoggerFactory.getLogger(AlertController.class);

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate readings",
               description = "Classifies a batch of readings and returns alerts for ABNORMAL and CRITICAL ones, in submission order. "
                   + "Readings that cannot be judged are listed per item and do not fail the batch.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Readings evaluated"),
        @ApiResponse(responseCode = "400", description = "Malformed request body",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<EvaluationResponse>> evaluateReadings(@RequestBody List<ReadingRequest> readings) {
        logger.info("Received {} readings for evaluation", readings.size());

        return alertService.evaluateReadings(readings)
            .map(response -> {
                logger.info("Created {} alerts from {} readings", response.getAlerts().size(), readings.size());
                return ResponseEntity.ok(response);
            })
            .doOnError(error -> logger.error("Error evaluating readings: {}", error.getMessage()));
    }

    @GetMapping("/classify")
    @Operation(summary = "Classify a value",
               description = "Returns NORMAL, ABNORMAL or CRITICAL for one value. Unknown metric types are NORMAL with recognized=false.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Value classified"),
        @ApiResponse(responseCode = "400", description = "Value is missing or not a finite number",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ClassificationResponse> classify(
            @Parameter(description = "Metric type", required = true, example = "HEART_RATE")
            @RequestParam String metricType,
            @Parameter(description = "Measured value", required = true, example = "110")
            @RequestParam double value) {
        logger.debug("Classifying {}={}", metricType, value);
        return alertService.classify(metricType, value);
    }

    @GetMapping("/ranges")
    @Operation(summary = "List reference ranges", description = "Returns the normal and critical bands of every known metric type")
    @ApiResponse(responseCode = "200", description = "Reference ranges retrieved",
                 content = @Content(schema = @Schema(implementation = RangeResponse.class)))
    public Flux<RangeResponse> getRanges() {
        return alertService.getRanges();
    }

    @GetMapping("/ranges/{metricType}")
    @Operation(summary = "Get reference range", description = "Returns the normal and critical bands of one metric type")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Reference range retrieved"),
        @ApiResponse(responseCode = "404", description = "No reference range for the metric type",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<RangeResponse> getRange(
            @Parameter(description = "Metric type", required = true, example = "HEART_RATE")
            @PathVariable String metricType) {
        return alertService.getRange(metricType)
            .doOnError(error -> logger.warn("Range lookup failed for {}: {}", metricType, error.getMessage()));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the Alert Service is running")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("Alert Service is running"));
    }
}
