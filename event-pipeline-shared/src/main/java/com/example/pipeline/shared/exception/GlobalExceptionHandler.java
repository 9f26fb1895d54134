package com.example.pipeline.shared.exception;

import com.example.pipeline.shared.dto.ErrorResponse;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ResourceNotFoundException: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<ErrorResponse> handleInvalidEventException(InvalidEventException ex, ServerWebExchange exchange) {
        log.warn("Rejected invalid event: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Event", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, ServerWebExchange exchange) {
        String errors = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining(", "));
        log.warn("Parameter validation error: {}", errors);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RequestNotPermitted ex, ServerWebExchange exchange) {
        log.warn("Rate limit exceeded on path {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return build(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", "Rate limit exceeded. Try again later.", exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        if (status.is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", status.value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (status.is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }
        return build(status, status.toString(), ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatusCode status, String error, String message, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(ZoneOffset.UTC),
                status.value(),
                error,
                message,
                exchange.getRequest().getPath().toString()
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
