package com.fintech.bookingpayments.service.event;

import com.fintech.bookingpayments.entity.PaymentRequestStatus;

/**
 * What a processor event asks of its payment request.
 */
public enum EventIntent {
    PAID(PaymentRequestStatus.PAID),
    EXPIRED(PaymentRequestStatus.EXPIRED),
    /**
     * A failed attempt. Recorded only, the customer can retry the same request.
     */
    FAILED(null),
    UNRECOGNIZED(null);

    private final PaymentRequestStatus targetStatus;

    EventIntent(PaymentRequestStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    /**
     * Status this intent transitions to, null when it triggers no transition.
     */
    public PaymentRequestStatus getTargetStatus() {
        return targetStatus;
    }
}
