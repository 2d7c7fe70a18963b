package com.fintech.bookingpayments.service.audit;

import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Emits audit entries for payment request access. A failing audit sink is logged and ignored;
 * it never blocks a payment transition.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditTrail {

    private static final String PAYMENT_REQUEST = "PaymentRequest";

    private final AuditLog auditLog;

    public void paymentRequestRead(PaymentRequest request, String actor) {
        record(new AuditEntry(AuditAction.READ, PAYMENT_REQUEST, request.getId(), request.getCustomerId(),
                actor, "status=" + request.getStatus(), LocalDateTime.now()));
    }

    public void paymentRequestCreated(PaymentRequest request, String actor) {
        record(new AuditEntry(AuditAction.CREATE, PAYMENT_REQUEST, request.getId(), request.getCustomerId(),
                actor, "booking=" + request.getBookingId() + " amount=" + request.getAmount(), LocalDateTime.now()));
    }

    public void paymentRequestTransitioned(PaymentRequest request, PaymentRequestStatus from,
                                           PaymentRequestStatus to, String actor, boolean applied) {
        record(new AuditEntry(applied ? AuditAction.TRANSITION : AuditAction.TRANSITION_REJECTED,
                PAYMENT_REQUEST, request.getId(), request.getCustomerId(), actor,
                from + "->" + to, LocalDateTime.now()));
    }

    public void linked(String entityType, Long entityId, Long customerId, Long bookingId, String actor) {
        record(new AuditEntry(AuditAction.LINK, entityType, entityId, customerId, actor,
                "booking=" + bookingId, LocalDateTime.now()));
    }

    private void record(AuditEntry entry) {
        try {
            auditLog.record(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry {} for {} {}", entry.getAction(), entry.getEntityType(),
                    entry.getEntityId(), e);
        }
    }
}
