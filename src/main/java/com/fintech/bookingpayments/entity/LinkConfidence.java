package com.fintech.bookingpayments.entity;

/**
 * How a payment's booking was established.
 */
public enum LinkConfidence {
    /**
     * Carried from the booking through the payment request.
     */
    EXPLICIT,

    /**
     * Matched after the fact by customer, time proximity and service name. Lower confidence.
     */
    INFERRED
}
