package com.fintech.bookingpayments.exception;

import java.util.List;

/**
 * Legacy matching found several equally close bookings. The payment stays unlinked.
 */
public class LinkageAmbiguousException extends PaymentReconciliationException {

    private final Long paymentId;
    private final List<Long> candidateBookingIds;

    public LinkageAmbiguousException(Long paymentId, List<Long> candidateBookingIds) {
        super(String.format("Payment %d matches bookings %s equally well", paymentId, candidateBookingIds));
        this.paymentId = paymentId;
        this.candidateBookingIds = List.copyOf(candidateBookingIds);
    }

    public Long getPaymentId() {
        return paymentId;
    }

    public List<Long> getCandidateBookingIds() {
        return candidateBookingIds;
    }
}
