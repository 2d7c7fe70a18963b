package com.fintech.bookingpayments.exception;

public class PiiCipherException extends PaymentReconciliationException {

    public PiiCipherException(String message) {
        super(message);
    }

    public PiiCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
