package com.fintech.bookingpayments.dto;

import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.WebhookEvent;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of processing one processor event. A replay returns the values stored in the ledger.
 */
@Value
@Builder
public class EventProcessingResult {

    String eventId;
    EventOutcome outcome;
    Long paymentRequestId;
    PaymentRequestStatus paymentRequestStatus;
    Long paymentId;
    String detail;
    boolean replayed;

    public static EventProcessingResult fromLedger(WebhookEvent event, boolean replayed) {
        return EventProcessingResult.builder()
                .eventId(event.getEventId())
                .outcome(event.getOutcome())
                .paymentRequestId(event.getPaymentRequestId())
                .paymentRequestStatus(event.getResultingStatus())
                .paymentId(event.getPaymentId())
                .detail(event.getDetail())
                .replayed(replayed)
                .build();
    }
}
