package com.fintech.bookingpayments.entity;

/**
 * Final result recorded for a processor event.
 */
public enum EventOutcome {
    /**
     * Claimed by a worker, not yet finished. Only visible inside the claiming transaction.
     */
    RECEIVED,

    /**
     * The event moved the payment request to a new status.
     */
    APPLIED,

    /**
     * The state machine refused the transition, usually because the request is already terminal.
     */
    REJECTED,

    /**
     * No payment request carries the event's checkout id.
     */
    ORPHANED,

    /**
     * A failed payment attempt. Recorded, the request stays open for another attempt.
     */
    FAILURE_RECORDED,

    /**
     * Event type this service does not act on.
     */
    IGNORED
}
