package com.fintech.bookingpayments.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Money actually captured. Correlated with its payment request through {@code checkoutId}
 * rather than a foreign key, so a payment can be recorded before or after the request is seen.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payments_checkout", columnList = "checkout_id", unique = true),
        @Index(name = "idx_payments_booking", columnList = "booking_id"),
        @Index(name = "idx_payments_customer_created", columnList = "customer_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id")
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "link_confidence", length = 20)
    private LinkConfidence linkConfidence;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "checkout_id", unique = true, length = 100)
    private String checkoutId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "EUR";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "external_transaction_id", length = 100)
    private String externalTransactionId;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "webhook_processed_at")
    private LocalDateTime webhookProcessedAt;

    @Column(name = "processor_event_type", length = 100)
    private String eventType;

    @Column(name = "processor_event_id", length = 200)
    private String eventId;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
