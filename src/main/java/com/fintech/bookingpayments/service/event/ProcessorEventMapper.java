package com.fintech.bookingpayments.service.event;

import com.fintech.bookingpayments.dto.CheckoutStatusResponse;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse.CheckoutStatus;
import com.fintech.bookingpayments.dto.WebhookEnvelope;
import com.fintech.bookingpayments.entity.EventSource;
import com.fintech.bookingpayments.entity.PaymentRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns webhook envelopes and checkout lookups into {@link ProcessorEvent}s.
 */
@Component
public class ProcessorEventMapper {

    /**
     * Event id namespace of poller-sourced ledger entries.
     */
    public static final String POLLER_EVENT_PREFIX = "poll:";

    public ProcessorEvent fromWebhook(WebhookEnvelope envelope) {
        return ProcessorEvent.builder()
                .eventId(envelope.getEventId())
                .source(EventSource.WEBHOOK)
                .eventType(envelope.getEventType())
                .checkoutId(envelope.getCheckoutId())
                .transactionId(envelope.getTransactionId())
                .amount(envelope.getAmount())
                .currency(envelope.getCurrency())
                .rawStatus(envelope.getStatus())
                .intent(intentFor(envelope.getEventType(), envelope.getStatus()))
                .occurredAt(envelope.getOccurredAt() == null ? LocalDateTime.now()
                        : envelope.getOccurredAt().atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime())
                .build();
    }

    /**
     * Builds the event a checkout lookup implies for {@code request}, or empty when the lookup
     * brings no news. A paid checkout always wins; otherwise a checkout the processor expired, or a
     * request older than {@code expireAfter}, expires.
     */
    public Optional<ProcessorEvent> fromCheckoutStatus(PaymentRequest request, CheckoutStatusResponse response,
                                                       LocalDateTime now, Duration expireAfter) {
        CheckoutStatus status = response.getStatus();
        boolean overdue = request.getCreatedAt() != null && request.getCreatedAt().isBefore(now.minus(expireAfter));

        EventIntent intent;
        String eventType;
        if (status == CheckoutStatus.PAID) {
            intent = EventIntent.PAID;
            eventType = "poll.checkout.paid";
        } else if (status == CheckoutStatus.EXPIRED) {
            intent = EventIntent.EXPIRED;
            eventType = "poll.checkout.expired";
        } else if (overdue) {
            intent = EventIntent.EXPIRED;
            eventType = "poll.request.overdue";
        } else if (status == CheckoutStatus.FAILED || status == CheckoutStatus.CANCELLED) {
            intent = EventIntent.FAILED;
            eventType = "poll.checkout." + status.name().toLowerCase(Locale.ROOT);
        } else {
            return Optional.empty();
        }

        String checkoutId = request.getCheckoutId();
        return Optional.of(ProcessorEvent.builder()
                .eventId(POLLER_EVENT_PREFIX + checkoutId + ":" + intent.name().toLowerCase(Locale.ROOT))
                .source(EventSource.POLLER)
                .eventType(eventType)
                .checkoutId(checkoutId)
                .transactionId(response.getTransactionCode())
                .amount(response.getAmount())
                .currency(response.getCurrency())
                .rawStatus(status == null ? null : status.name())
                .intent(intent)
                .occurredAt(response.getProcessedAt() == null ? now : response.getProcessedAt())
                .build());
    }

    /**
     * Event type decides; the status field only downgrades a success type that reports a failure,
     * or fills in when the type is unknown.
     */
    static EventIntent intentFor(String eventType, String status) {
        String type = eventType == null ? "" : eventType.trim().toLowerCase(Locale.ROOT);
        CheckoutStatus reported = status == null || status.isBlank() ? null : CheckoutStatus.fromProcessorValue(status);

        EventIntent byType = switch (type) {
            case "checkout.completed", "checkout.paid", "transaction.successful" -> EventIntent.PAID;
            case "checkout.failed", "checkout.cancelled", "transaction.failed" -> EventIntent.FAILED;
            case "checkout.expired" -> EventIntent.EXPIRED;
            default -> EventIntent.UNRECOGNIZED;
        };

        if (byType == EventIntent.PAID
                && (reported == CheckoutStatus.FAILED || reported == CheckoutStatus.CANCELLED)) {
            return EventIntent.FAILED;
        }
        if (byType == EventIntent.UNRECOGNIZED && reported != null) {
            return switch (reported) {
                case PAID -> EventIntent.PAID;
                case FAILED, CANCELLED -> EventIntent.FAILED;
                default -> EventIntent.UNRECOGNIZED;
            };
        }
        return byType;
    }
}
