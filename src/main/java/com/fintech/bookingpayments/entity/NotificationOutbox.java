package com.fintech.bookingpayments.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Outbound notification written in the same transaction as the transition that caused it.
 * Delivered later by {@code NotificationDispatcher}; delivery failures never touch the payment request.
 * No plaintext PII is stored here, names are resolved at delivery time.
 */
@Entity
@Table(name = "notification_outbox", indexes = {
        @Index(name = "idx_notification_outbox_status_next", columnList = "status, next_attempt_at, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class NotificationOutbox {

    @Id
    @Column(nullable = false, updatable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentRequestFact fact;

    @Column(name = "payment_request_id", nullable = false)
    private Long paymentRequestId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "booking_id")
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_status", nullable = false, length = 20)
    private PaymentRequestStatus requestStatus;

    @Column(precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private NotificationStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    public static NotificationOutbox newEntry(PaymentRequestFact fact, PaymentRequest request) {
        NotificationOutbox entry = new NotificationOutbox();
        entry.id = UUID.randomUUID().toString();
        entry.fact = fact;
        entry.paymentRequestId = request.getId();
        entry.customerId = request.getCustomerId();
        entry.bookingId = request.getBookingId();
        entry.requestStatus = request.getStatus();
        entry.amount = request.getAmount();
        entry.currency = request.getCurrency();
        entry.status = NotificationStatus.NEW;
        entry.attemptCount = 0;
        entry.createdAt = LocalDateTime.now();
        entry.updatedAt = entry.createdAt;
        return entry;
    }

    public void markSent() {
        this.status = NotificationStatus.SENT;
        this.sentAt = LocalDateTime.now();
        this.updatedAt = this.sentAt;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    public void markRetry(String error, Duration backoff) {
        this.status = NotificationStatus.RETRY;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = LocalDateTime.now().plus(backoff);
        this.updatedAt = LocalDateTime.now();
    }

    public void markDead(String error) {
        this.status = NotificationStatus.DEAD;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = null;
        this.updatedAt = LocalDateTime.now();
    }
}
