package com.fintech.bookingpayments.exception;

public class MalformedWebhookException extends PaymentReconciliationException {

    public MalformedWebhookException(String message) {
        super(message);
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
