package com.fintech.bookingpayments.service.event;

import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.WebhookEvent;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.repository.WebhookEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point shared by webhook ingestion and the reconciliation poller.
 * An event id already in the ledger is answered from the ledger and never re-applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEventProcessor {

    private final WebhookEventRepository webhookEventRepository;
    private final PaymentEventApplier paymentEventApplier;
    private final PaymentRequestRepository paymentRequestRepository;
    private final BookingRepository bookingRepository;
    private final MeterRegistry meterRegistry;

    public EventProcessingResult process(ProcessorEvent event) {
        Optional<WebhookEvent> existing = webhookEventRepository.findByEventId(event.getEventId());
        if (existing.isPresent()) {
            return replay(existing.get());
        }

        EventProcessingResult result;
        try {
            result = paymentEventApplier.apply(event);
        } catch (DataIntegrityViolationException e) {
            // lost the ledger insert to a concurrent delivery of the same event
            return webhookEventRepository.findByEventId(event.getEventId())
                    .map(this::replay)
                    .orElseThrow(() -> e);
        }

        if (result.getOutcome() == EventOutcome.APPLIED
                && result.getPaymentRequestStatus() == PaymentRequestStatus.PAID) {
            markBookingPaid(result.getPaymentRequestId());
        }

        meterRegistry.counter("payments.events.processed",
                "source", event.getSource().name(),
                "outcome", result.getOutcome().name()).increment();
        log.info("Processed {} event {} ({}) for checkout {}: {}", event.getSource(), event.getEventId(),
                event.getEventType(), event.getCheckoutId(), result.getOutcome());
        return result;
    }

    /**
     * Runs after the payment transaction has committed. A failure here leaves the payment settled
     * and is only logged.
     */
    private void markBookingPaid(Long paymentRequestId) {
        try {
            Optional<PaymentRequest> request = paymentRequestRepository.findById(paymentRequestId);
            if (request.isEmpty()) {
                return;
            }
            Long bookingId = request.get().getBookingId();
            if (bookingRepository.markPaid(bookingId) > 0) {
                log.info("Booking {} marked paid by payment request {}", bookingId, paymentRequestId);
            }
        } catch (DataAccessException e) {
            log.warn("Could not mark booking paid for payment request {}: {}", paymentRequestId, e.getMessage());
            meterRegistry.counter("payments.bookings.mark_paid.failures").increment();
        }
    }

    private EventProcessingResult replay(WebhookEvent stored) {
        log.info("Event {} already processed with outcome {}, returning stored result",
                stored.getEventId(), stored.getOutcome());
        meterRegistry.counter("payments.events.duplicates", "source", stored.getSource().name()).increment();
        return EventProcessingResult.fromLedger(stored, true);
    }
}
