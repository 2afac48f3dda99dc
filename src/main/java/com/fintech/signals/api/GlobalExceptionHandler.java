package com.fintech.signals.api;

import com.fintech.signals.service.IndicatorQueryService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle service layer validation errors.
     */
    @ExceptionHandler(IndicatorQueryService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            IndicatorQueryService.ValidationException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), path);

        log.warn("Service validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * The buffer sink is stopped, restarting or did not answer in time.
     */
    @ExceptionHandler(IndicatorQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            IndicatorQueryService.ServiceException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", ex.getMessage(), path);

        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Handle validation constraint violations (e.g. negative n).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        ConstraintViolation<?> violation = ex.getConstraintViolations().iterator().next();
        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.rejected(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            String.format("Parameter '%s' %s", getFieldName(violation), violation.getMessage()),
            path,
            violation.getInvalidValue()
        );

        log.warn("Validation error on {}: {}", path, error.message());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., string instead of number).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = ErrorResponse.rejected(
            HttpStatus.BAD_REQUEST,
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a non-negative integer", ex.getName()),
            path,
            ex.getValue()
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred.", path);

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
