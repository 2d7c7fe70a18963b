package com.fintech.bookingpayments.exception;

/**
 * No payment request matches an event's checkout id. Recorded and acknowledged, never retried.
 */
public class OrphanedEventException extends PaymentReconciliationException {

    private final String checkoutId;

    public OrphanedEventException(String checkoutId) {
        super("No payment request found for checkout " + checkoutId);
        this.checkoutId = checkoutId;
    }

    public String getCheckoutId() {
        return checkoutId;
    }
}
