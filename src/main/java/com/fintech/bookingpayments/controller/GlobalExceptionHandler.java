package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.dto.ErrorResponse;
import com.fintech.bookingpayments.exception.InvalidTransitionException;
import com.fintech.bookingpayments.exception.LinkageConflictException;
import com.fintech.bookingpayments.exception.MalformedWebhookException;
import com.fintech.bookingpayments.exception.PaymentRequestConflictException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.exception.WebhookAuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleWebhookAuthentication(WebhookAuthenticationException ex) {
        return error(HttpStatus.UNAUTHORIZED, "WEBHOOK_AUTHENTICATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(MalformedWebhookException.class)
    public ResponseEntity<ErrorResponse> handleMalformedWebhook(MalformedWebhookException ex) {
        log.warn("Malformed webhook: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_WEBHOOK", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.info("Invalid transition: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler({PaymentRequestConflictException.class, LinkageConflictException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex) {
        log.info("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT, "CONSTRAINT_VIOLATION", "Request conflicts with stored data");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, Instant.now()));
    }
}
