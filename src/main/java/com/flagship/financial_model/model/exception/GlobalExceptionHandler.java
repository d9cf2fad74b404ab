package com.flagship.financial_model.model.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.model.MissingDatasetException;
import com.flagship.financial_model.statement.MissingOpeningSnapshotException;
import com.flagship.financial_model.validation.InputValidationException;
import com.flagship.financial_model.validation.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps model failures to consistent JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Malformed Request")
            .message("Request body could not be parsed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingDatasetException.class)
    public ResponseEntity<ErrorResponse> handleMissingDataset(MissingDatasetException e) {
        log.warn("No dataset supplied: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Dataset")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ErrorResponse> handleInputValidation(InputValidationException e) {
        log.warn("Input rejected: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Input Validation Failed")
            .message(e.getMessage())
            .issues(e.getIssues())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingOpeningSnapshotException.class)
    public ResponseEntity<ErrorResponse> handleMissingOpeningSnapshot(MissingOpeningSnapshotException e) {
        log.warn("Missing opening snapshot: openingYear={}, firstStatementYear={}",
            e.getOpeningYear(), e.getFirstStatementYear());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Opening Snapshot")
            .message(e.getMessage())
            .details(Map.of(
                "opening_year", String.valueOf(e.getOpeningYear()),
                "first_statement_year", String.valueOf(e.getFirstStatementYear())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        @JsonProperty("error")
        String error;

        @JsonProperty("message")
        String message;

        @JsonProperty("details")
        Map<String, String> details;

        @JsonProperty("issues")
        List<ValidationIssue> issues;

        @JsonProperty("timestamp")
        Instant timestamp;
    }
}
