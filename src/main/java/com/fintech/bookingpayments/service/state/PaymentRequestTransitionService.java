package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.NotificationOutbox;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestFact;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.NotificationOutboxRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * The single write path for payment request status.
 * <p>
 * Webhooks, the reconciliation poller, cancellations and administrative operations all call
 * {@link #applyTransition}. The status is changed with one conditional UPDATE on the stored status,
 * so of two racing transitions exactly one lands and the other observes {@code applied=false}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentRequestTransitionService {

    private final PaymentRequestRepository paymentRequestRepository;
    private final NotificationOutboxRepository notificationOutboxRepository;
    private final AuditTrail auditTrail;

    /**
     * Moves {@code request} to {@code target} if the state machine allows it and the stored status
     * still equals the snapshot's status.
     *
     * @param request  snapshot; its status is the expected source state
     * @param target   desired status
     * @param evidence who asked and why
     * @return the stored request after the attempt and whether this call changed it
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TransitionResult applyTransition(PaymentRequest request, PaymentRequestStatus target,
                                            TransitionEvidence evidence) {
        PaymentRequestStatus from = request.getStatus();

        if (!PaymentRequestStateMachine.isAllowed(from, target)) {
            log.info("Rejected transition of payment request {} from {} to {} requested by {}",
                    request.getId(), from, target, evidence.getActor());
            auditTrail.paymentRequestTransitioned(request, from, target, evidence.getActor(), false);
            return TransitionResult.rejected(request);
        }

        LocalDateTime now = LocalDateTime.now();
        int updated = paymentRequestRepository.compareAndSetStatus(
                request.getId(),
                from,
                target,
                now,
                evidence.getSource(),
                truncate(evidence.getReference(), 200),
                target == PaymentRequestStatus.SENT && evidence.getCheckoutId() != null
                        ? evidence.getCheckoutId() : request.getCheckoutId(),
                target == PaymentRequestStatus.SENT ? now : request.getSentAt(),
                target == PaymentRequestStatus.PAID ? now : null,
                target == PaymentRequestStatus.CANCELLED || target == PaymentRequestStatus.EXPIRED ? now : null,
                target == PaymentRequestStatus.CANCELLED ? truncate(evidence.getReason(), 500) : null
        );

        PaymentRequest current = paymentRequestRepository.findById(request.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", request.getId()));

        if (updated == 0) {
            log.info("Payment request {} is no longer {} (now {}), transition to {} by {} not applied",
                    request.getId(), from, current.getStatus(), target, evidence.getActor());
            auditTrail.paymentRequestTransitioned(current, from, target, evidence.getActor(), false);
            return TransitionResult.rejected(current);
        }

        PaymentRequestFact fact = PaymentRequestFact.forTarget(target);
        if (fact != null) {
            notificationOutboxRepository.save(NotificationOutbox.newEntry(fact, current));
        }

        log.info("Payment request {} moved from {} to {} by {}", current.getId(), from, target, evidence.getActor());
        auditTrail.paymentRequestTransitioned(current, from, target, evidence.getActor(), true);

        return TransitionResult.applied(current, from, fact);
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
