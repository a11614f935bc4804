package com.al.pricetransparency.exception;

import com.al.pricetransparency.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PricingApiException.class)
    public ResponseEntity<ErrorResponse> handlePricingApiError(PricingApiException e, HttpServletRequest request) {
        log.error("Pricing API Error: {}", e.getMessage());
        ResponseEntity<ErrorResponse> response = buildResponse(HttpStatus.BAD_GATEWAY, "Upstream Error",
                "Failed to fetch pricing data from external source", request);
        response.getBody().setUpstreamStatus(e.getStatusCode());
        return response;
    }

    @ExceptionHandler(UnsupportedFileFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedFileFormatException e,
            HttpServletRequest request) {
        log.warn("Unsupported File Format: {}", e.getMessage());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Unsupported File Format", e.getMessage(), request);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ErrorResponse> handleIngestionError(IngestionException e, HttpServletRequest request) {
        log.warn("Ingestion Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Ingestion Error", e.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", details, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI(),
                null);
        return new ResponseEntity<>(response, status);
    }
}
