package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestFact;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import lombok.Value;

/**
 * Result of {@link PaymentRequestTransitionService#applyTransition}.
 * <p>
 * {@code request} is the request as stored after the attempt. {@code previousStatus} and {@code fact}
 * are only set when this call changed the status.
 */
@Value
public class TransitionResult {

    PaymentRequest request;
    boolean applied;
    PaymentRequestStatus previousStatus;
    PaymentRequestFact fact;

    static TransitionResult applied(PaymentRequest request, PaymentRequestStatus previousStatus,
                                    PaymentRequestFact fact) {
        return new TransitionResult(request, true, previousStatus, fact);
    }

    static TransitionResult rejected(PaymentRequest current) {
        return new TransitionResult(current, false, null, null);
    }
}
