package com.fintech.bookingpayments.exception;

import com.fintech.bookingpayments.entity.PaymentRequestStatus;

/**
 * Raised by administrative operations whose transition was refused by the state machine.
 * Event processing never throws this; it records {@code applied=false} instead.
 */
public class InvalidTransitionException extends PaymentReconciliationException {

    private final Long paymentRequestId;
    private final PaymentRequestStatus currentStatus;
    private final PaymentRequestStatus targetStatus;

    public InvalidTransitionException(Long paymentRequestId, PaymentRequestStatus currentStatus,
                                      PaymentRequestStatus targetStatus) {
        super(String.format("Payment request %d cannot move from %s to %s",
                paymentRequestId, currentStatus, targetStatus));
        this.paymentRequestId = paymentRequestId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public Long getPaymentRequestId() {
        return paymentRequestId;
    }

    public PaymentRequestStatus getCurrentStatus() {
        return currentStatus;
    }

    public PaymentRequestStatus getTargetStatus() {
        return targetStatus;
    }
}
