package com.fintech.bookingpayments.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Deduplication ledger. One row per processor event id, webhook or poller sourced.
 * A repeated event id returns the stored outcome without re-applying anything.
 */
@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_events_event_id", columnList = "event_id", unique = true),
        @Index(name = "idx_webhook_events_checkout", columnList = "checkout_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, length = 200)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventSource source;

    @Column(name = "event_type", length = 100)
    private String eventType;

    @Column(name = "checkout_id", length = 100)
    private String checkoutId;

    @Column(name = "payment_request_id")
    private Long paymentRequestId;

    @Column(name = "payment_id")
    private Long paymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "resulting_status", length = 20)
    private PaymentRequestStatus resultingStatus;

    @Column(length = 500)
    private String detail;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public void complete(EventOutcome outcome, PaymentRequestStatus resultingStatus, String detail) {
        this.outcome = outcome;
        this.resultingStatus = resultingStatus;
        this.detail = detail != null && detail.length() > 500 ? detail.substring(0, 500) : detail;
        this.processedAt = LocalDateTime.now();
    }
}
