package com.fintech.bookingpayments.exception;

/**
 * Webhook signature missing or invalid. Nothing has been read or written when this is thrown.
 */
public class WebhookAuthenticationException extends PaymentReconciliationException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
