package com.fintech.bookingpayments.service;

import com.fintech.bookingpayments.dto.CancellationResult;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.TransitionSource;
import com.fintech.bookingpayments.exception.InvalidTransitionException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.state.PaymentRequestTransitionService;
import com.fintech.bookingpayments.service.state.TransitionEvidence;
import com.fintech.bookingpayments.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Customer and admin cancellation of payment requests.
 * <p>
 * Cancelling a request that is already paid, cancelled or expired is not an error: the result
 * reports the status the request is in. Losing a race against a webhook is reported the same way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCancellationService {

    // pending -> sent is the only non-terminal move a racing writer can make
    private static final int MAX_ATTEMPTS = 3;

    private final PaymentRequestRepository paymentRequestRepository;
    private final PaymentRequestTransitionService transitionService;

    /**
     * @throws ResourceNotFoundException  if the request does not exist
     * @throws InvalidTransitionException if the request kept changing under us
     */
    public CancellationResult cancel(Long paymentRequestId, String reason, TransitionSource requestedBy) {
        String effectiveReason = StringUtils.hasText(reason) ? reason.trim() : defaultReason(requestedBy);

        PaymentRequestStatus lastSeen = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            PaymentRequest request = paymentRequestRepository.findById(paymentRequestId)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment request", paymentRequestId));

            if (request.getStatus().isTerminal()) {
                log.info("Payment request {} is already {}, nothing to cancel", paymentRequestId, request.getStatus());
                return CancellationResult.builder()
                        .paymentRequestId(paymentRequestId)
                        .status(request.getStatus())
                        .cancelled(false)
                        .message("Payment request is already " + request.getStatus().name().toLowerCase())
                        .build();
            }

            TransitionResult result = transitionService.applyTransition(request, PaymentRequestStatus.CANCELLED,
                    TransitionEvidence.cancellation(requestedBy, requestedBy.name().toLowerCase(), effectiveReason));
            if (result.isApplied()) {
                return CancellationResult.builder()
                        .paymentRequestId(paymentRequestId)
                        .status(PaymentRequestStatus.CANCELLED)
                        .cancelled(true)
                        .message("Payment request cancelled")
                        .build();
            }

            lastSeen = result.getRequest().getStatus();
            log.debug("Cancellation of payment request {} lost a race (now {}), attempt {}",
                    paymentRequestId, lastSeen, attempt);
        }

        throw new InvalidTransitionException(paymentRequestId, lastSeen, PaymentRequestStatus.CANCELLED);
    }

    /**
     * Customer-facing variant. Never throws, so the booking flow can always be restarted.
     */
    public CancellationResult cancelForCustomer(Long paymentRequestId, String reason) {
        try {
            return cancel(paymentRequestId, reason, TransitionSource.CUSTOMER);
        } catch (RuntimeException e) {
            log.warn("Customer cancellation of payment request {} failed: {}", paymentRequestId, e.getMessage());
            PaymentRequestStatus status = null;
            try {
                status = paymentRequestRepository.findById(paymentRequestId)
                        .map(PaymentRequest::getStatus)
                        .orElse(null);
            } catch (RuntimeException lookupFailure) {
                log.warn("Could not read payment request {} after failed cancellation", paymentRequestId,
                        lookupFailure);
            }
            return CancellationResult.builder()
                    .paymentRequestId(paymentRequestId)
                    .status(status)
                    .cancelled(false)
                    .message("Cancellation failed: " + e.getMessage())
                    .build();
        }
    }

    private static String defaultReason(TransitionSource requestedBy) {
        return requestedBy == TransitionSource.ADMIN ? "Cancelled by admin" : "Cancelled by customer";
    }
}
