package com.fintech.bookingpayments.exception;

/**
 * Base exception for payment request, webhook and reconciliation errors.
 */
public class PaymentReconciliationException extends RuntimeException {

    public PaymentReconciliationException(String message) {
        super(message);
    }

    public PaymentReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
