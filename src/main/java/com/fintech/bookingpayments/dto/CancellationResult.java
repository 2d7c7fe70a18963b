package com.fintech.bookingpayments.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a cancellation. {@code status} is the request's status after the call, null only
 * when the request could not be read at all.
 */
@Value
@Builder
public class CancellationResult {

    @JsonProperty("payment_request_id")
    Long paymentRequestId;

    PaymentRequestStatus status;

    /**
     * True only when this call performed the cancellation.
     */
    boolean cancelled;

    String message;
}
