package com.folautech.alert.exception;

import com.folautech.alert.model.ErrorResponse;
import com.folautech.metric.exception.ErrorCode;
import com.folautech.metric.exception.MetricEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MetricEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(MetricEngineException ex, ServerWebExchange exchange) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            logger.error("Server error: {}", ex.getMessage(), ex);
        } else {
            logger.warn("Client error: {}", ex.getMessage());
        }
        return buildResponse(status, ex.getErrorCode().getCode(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        logger.warn("Invalid request: {}", ex.getReason());
        return buildResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getReason(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        logger.warn("Request failed with {}: {}", ex.getStatusCode(), ex.getReason());
        String code = ex.getStatusCode() instanceof HttpStatus httpStatus ? httpStatus.name() : "ERROR";
        return buildResponse(ex.getStatusCode(), code, ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, ServerWebExchange exchange) {
        logger.error("Unexpected error", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", exchange);
    }

    static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case INVALID_VALUE, MISSING_READING -> HttpStatus.BAD_REQUEST;
            case REGISTRY_INTEGRITY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatusCode status, String code, String message,
                                                        ServerWebExchange exchange) {
        ErrorResponse body = new ErrorResponse(message, status.value(), code, Instant.now().toString(),
            exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
