package com.fintech.bookingpayments.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A request for money tied to one booking and one customer.
 * <p>
 * Status is only ever changed through a conditional update on the stored status
 * (see {@code PaymentRequestRepository#compareAndSetStatus}); instances loaded by JPA are snapshots.
 * {@code bookingId} is null only for requests created before bookings were linked.
 */
@Entity
@Table(name = "payment_requests", indexes = {
        @Index(name = "idx_payment_requests_status_updated_at", columnList = "status, updated_at"),
        @Index(name = "idx_payment_requests_booking", columnList = "booking_id"),
        @Index(name = "idx_payment_requests_checkout", columnList = "checkout_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "EUR";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentRequestStatus status;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "checkout_id", unique = true, length = 100)
    private String checkoutId;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_transition_source", length = 20)
    private TransitionSource lastTransitionSource;

    @Column(name = "last_transition_reference", length = 200)
    private String lastTransitionReference;

    @Column(name = "last_webhook_at")
    private LocalDateTime lastWebhookAt;

    @Column(name = "webhook_failures", nullable = false)
    @Builder.Default
    private Integer webhookFailures = 0;

    @Column(name = "reconciliation_attempts", nullable = false)
    @Builder.Default
    private Integer reconciliationAttempts = 0;

    /**
     * Consecutive failed processor lookups. Reset by the next successful lookup.
     */
    @Column(name = "reconciliation_failures", nullable = false)
    @Builder.Default
    private Integer reconciliationFailures = 0;

    @Column(name = "last_reconciled_at")
    private LocalDateTime lastReconciledAt;

    @Column(name = "last_reconciliation_error", length = 500)
    private String lastReconciliationError;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
