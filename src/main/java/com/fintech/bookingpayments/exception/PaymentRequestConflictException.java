package com.fintech.bookingpayments.exception;

public class PaymentRequestConflictException extends PaymentReconciliationException {

    public PaymentRequestConflictException(String message) {
        super(message);
    }
}
