package com.fintech.bookingpayments.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.dto.WebhookEnvelope;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.exception.InvalidTransitionException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.state.PaymentRequestTransitionService;
import com.fintech.bookingpayments.service.state.TransitionEvidence;
import com.fintech.bookingpayments.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces processor events for sandbox deployments.
 * <p>
 * The bean only exists when {@code payment.environment} is {@code sandbox}. Synthetic envelopes are
 * signed with the configured secret and go through {@link WebhookIngestionService#ingest} like any
 * real webhook, ledger and state machine included.
 */
@Service
@ConditionalOnProperty(name = "payment.environment", havingValue = "sandbox")
@RequiredArgsConstructor
@Slf4j
public class SandboxEventSimulator {

    public enum SimulatedOutcome {
        SUCCESS,
        FAILURE
    }

    private final PaymentRequestRepository paymentRequestRepository;
    private final PaymentRequestTransitionService transitionService;
    private final WebhookIngestionService ingestionService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    public EventProcessingResult simulate(Long paymentRequestId, SimulatedOutcome outcome) {
        PaymentRequest request = paymentRequestRepository.findById(paymentRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", paymentRequestId));

        if (request.getStatus() == PaymentRequestStatus.PENDING || request.getCheckoutId() == null) {
            request = sendWithSandboxCheckout(request);
        }

        WebhookEnvelope envelope = WebhookEnvelope.builder()
                .eventId("sandbox_" + UUID.randomUUID())
                .eventType(outcome == SimulatedOutcome.SUCCESS ? "checkout.completed" : "checkout.failed")
                .checkoutId(request.getCheckoutId())
                .transactionId(outcome == SimulatedOutcome.SUCCESS ? "sandbox_tx_" + UUID.randomUUID() : null)
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .status(outcome == SimulatedOutcome.SUCCESS ? "PAID" : "FAILED")
                .occurredAt(OffsetDateTime.now())
                .build();

        String body;
        try {
            body = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize sandbox envelope", e);
        }

        log.info("Simulating {} webhook {} for payment request {}", outcome, envelope.getEventId(), request.getId());
        return ingestionService.ingest(body, signatureVerifier.sign(body));
    }

    private PaymentRequest sendWithSandboxCheckout(PaymentRequest request) {
        String checkoutId = request.getCheckoutId() != null ? request.getCheckoutId()
                : "co_sandbox_" + System.currentTimeMillis() + "_"
                + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000, 0xfffff));
        TransitionResult result = transitionService.applyTransition(request, PaymentRequestStatus.SENT,
                TransitionEvidence.checkoutSent(checkoutId, "sandbox"));
        if (!result.isApplied()) {
            throw new InvalidTransitionException(request.getId(), result.getRequest().getStatus(),
                    PaymentRequestStatus.SENT);
        }
        return result.getRequest();
    }
}
