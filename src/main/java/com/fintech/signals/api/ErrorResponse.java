package com.fintech.signals.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Error body of the indicator API. Field names follow the snake_case of
 * {@link IndicatorResponse}; the timestamp is RFC 3339 like the indicator timestamps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Why a request could not be answered")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error category", example = "TYPE_MISMATCH",
        allowableValues = {"TYPE_MISMATCH", "VALIDATION_ERROR", "SERVICE_UNAVAILABLE", "INTERNAL_ERROR"})
    String error,

    @Schema(description = "Human-readable error message", example = "Entry count must be a non-negative integer")
    String message,

    @Schema(description = "Request path", example = "/tail/abc")
    String path,

    @Schema(description = "Entry count as sent by the client, for rejected counts", example = "abc")
    @JsonProperty("rejected_value")
    String rejectedValue,

    @Schema(description = "When the error occurred", example = "2024-01-03T10:30:00Z")
    String timestamp
) {

    static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return rejected(status, error, message, path, null);
    }

    static ErrorResponse rejected(HttpStatus status, String error, String message, String path, Object rejectedValue) {
        return new ErrorResponse(
            status.value(),
            error,
            message,
            path,
            rejectedValue == null ? null : String.valueOf(rejectedValue),
            Instant.now().toString());
    }
}
