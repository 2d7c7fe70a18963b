package com.fintech.bookingpayments.service.event;

import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.EventSource;
import com.fintech.bookingpayments.entity.Payment;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.WebhookEvent;
import com.fintech.bookingpayments.exception.OrphanedEventException;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.repository.WebhookEventRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import com.fintech.bookingpayments.service.linkage.LinkageResolver;
import com.fintech.bookingpayments.service.state.PaymentRequestTransitionService;
import com.fintech.bookingpayments.service.state.TransitionEvidence;
import com.fintech.bookingpayments.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Applies one processor event inside a single transaction: claims the event id in the ledger,
 * resolves the payment request, runs the transition, records the payment and stores the outcome.
 * <p>
 * The ledger row is inserted first. A concurrent worker carrying the same event id fails on the
 * unique index and rolls back without side effects; {@link PaymentEventProcessor} then replays the
 * stored outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEventApplier {

    private final WebhookEventRepository webhookEventRepository;
    private final PaymentRequestRepository paymentRequestRepository;
    private final PaymentRequestTransitionService transitionService;
    private final LinkageResolver linkageResolver;
    private final AuditTrail auditTrail;

    @Transactional
    public EventProcessingResult apply(ProcessorEvent event) {
        WebhookEvent ledger = webhookEventRepository.saveAndFlush(WebhookEvent.builder()
                .eventId(event.getEventId())
                .source(event.getSource())
                .eventType(event.getEventType())
                .checkoutId(event.getCheckoutId())
                .outcome(EventOutcome.RECEIVED)
                .receivedAt(LocalDateTime.now())
                .build());

        PaymentRequest request;
        try {
            request = resolveRequest(event.getCheckoutId());
        } catch (OrphanedEventException e) {
            log.warn("Orphaned {} event {} ({}): {}", event.getSource(), event.getEventId(),
                    event.getEventType(), e.getMessage());
            ledger.complete(EventOutcome.ORPHANED, null, e.getMessage());
            return EventProcessingResult.fromLedger(webhookEventRepository.save(ledger), false);
        }

        ledger.setPaymentRequestId(request.getId());
        auditTrail.paymentRequestRead(request, event.getSource().name().toLowerCase() + ":" + event.getEventId());

        switch (event.getIntent()) {
            case PAID, EXPIRED -> applyTransition(request, event, ledger);
            case FAILED -> recordFailure(request, event, ledger);
            case UNRECOGNIZED -> {
                touchWebhook(request, event);
                log.info("Ignoring event {} of type {} for payment request {}",
                        event.getEventId(), event.getEventType(), request.getId());
                ledger.complete(EventOutcome.IGNORED, request.getStatus(),
                        "Unhandled event type " + event.getEventType());
            }
        }

        return EventProcessingResult.fromLedger(webhookEventRepository.save(ledger), false);
    }

    private PaymentRequest resolveRequest(String checkoutId) {
        return paymentRequestRepository.findByCheckoutId(checkoutId)
                .orElseThrow(() -> new OrphanedEventException(checkoutId));
    }

    private void applyTransition(PaymentRequest request, ProcessorEvent event, WebhookEvent ledger) {
        PaymentRequestStatus target = event.getIntent().getTargetStatus();
        TransitionResult result = transitionService.applyTransition(request, target,
                TransitionEvidence.forEvent(event.getSource(), event.getEventId()));
        touchWebhook(request, event);

        PaymentRequest current = result.getRequest();
        if (!result.isApplied()) {
            ledger.complete(EventOutcome.REJECTED, current.getStatus(),
                    String.format("Transition to %s refused, request is %s", target, current.getStatus()));
            return;
        }

        if (target == PaymentRequestStatus.PAID) {
            Payment payment = linkageResolver.recordCompletedPayment(current, event);
            ledger.setPaymentId(payment.getId());
        }
        ledger.complete(EventOutcome.APPLIED, current.getStatus(), null);
    }

    private void recordFailure(PaymentRequest request, ProcessorEvent event, WebhookEvent ledger) {
        if (event.getSource() == EventSource.WEBHOOK) {
            paymentRequestRepository.recordWebhookFailure(request.getId(), LocalDateTime.now());
        }
        log.info("Recorded failed payment attempt {} for payment request {}, request stays {}",
                event.getEventId(), request.getId(), request.getStatus());
        ledger.complete(EventOutcome.FAILURE_RECORDED, request.getStatus(),
                "Payment attempt failed: " + event.getEventType());
    }

    private void touchWebhook(PaymentRequest request, ProcessorEvent event) {
        if (event.getSource() == EventSource.WEBHOOK) {
            paymentRequestRepository.touchLastWebhook(request.getId(), LocalDateTime.now());
        }
    }
}
