package com.fintech.bookingpayments.exception;

public class LinkageConflictException extends PaymentReconciliationException {

    public LinkageConflictException(String message) {
        super(message);
    }
}
