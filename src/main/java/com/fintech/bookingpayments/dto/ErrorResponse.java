package com.fintech.bookingpayments.dto;

import lombok.Value;

import java.time.Instant;

/**
 * Error body returned by every endpoint. {@code code} is machine-readable.
 */
@Value
public class ErrorResponse {

    String code;
    String message;
    Instant timestamp;
}
