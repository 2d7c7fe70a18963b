package com.fintech.bookingpayments.entity;

/**
 * Facts emitted by an applied transition and delivered to the notifier.
 */
public enum PaymentRequestFact {
    PAYMENT_COMPLETED,
    REQUEST_CLOSED;

    /**
     * The fact a transition into {@code target} emits, or null when it emits none.
     */
    public static PaymentRequestFact forTarget(PaymentRequestStatus target) {
        return switch (target) {
            case PAID -> PAYMENT_COMPLETED;
            case CANCELLED, EXPIRED -> REQUEST_CLOSED;
            case PENDING, SENT -> null;
        };
    }
}
