package com.fintech.bookingpayments.entity;

/**
 * Lifecycle status of a payment request.
 */
public enum PaymentRequestStatus {
    /**
     * Created for a booking, checkout not yet handed to the customer.
     */
    PENDING,

    /**
     * Checkout created at the processor and sent to the customer.
     * This is the state the reconciliation poller watches.
     */
    SENT,

    /**
     * Money captured. Terminal.
     */
    PAID,

    /**
     * Cancelled by the customer, an administrator or a superseding request. Terminal.
     */
    CANCELLED,

    /**
     * Never paid within the allowed time. Terminal.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED || this == EXPIRED;
    }

    public boolean isActive() {
        return this == PENDING || this == SENT;
    }
}
