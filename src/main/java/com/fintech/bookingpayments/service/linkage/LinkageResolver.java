package com.fintech.bookingpayments.service.linkage;

import com.fintech.bookingpayments.dto.BackfillReport;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.LinkConfidence;
import com.fintech.bookingpayments.entity.Payment;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentStatus;
import com.fintech.bookingpayments.exception.LinkageAmbiguousException;
import com.fintech.bookingpayments.exception.LinkageConflictException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.PaymentRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import com.fintech.bookingpayments.service.event.ProcessorEvent;
import com.fintech.bookingpayments.service.pii.CustomerNameResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps every payment attributable to one booking.
 * <p>
 * New records carry {@code booking_id} from booking to payment request to payment. Only legacy
 * payments without one fall back to {@link LegacyBookingMatcher}, and such links are tagged
 * {@link LinkConfidence#INFERRED}. An existing booking id is never overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkageResolver {

    private static final String PAYMENT_METHOD = "card";

    private final PaymentRepository paymentRepository;
    private final PaymentRequestRepository paymentRequestRepository;
    private final BookingRepository bookingRepository;
    private final LegacyBookingMatcher legacyBookingMatcher;
    private final CustomerNameResolver customerNameResolver;
    private final AuditTrail auditTrail;

    public LinkageResult resolveBookingId(Payment payment) {
        if (payment.getBookingId() != null) {
            LinkConfidence confidence = payment.getLinkConfidence() == null
                    ? LinkConfidence.EXPLICIT : payment.getLinkConfidence();
            return new LinkageResult.Linked(payment.getBookingId(), confidence);
        }

        if (payment.getCheckoutId() != null) {
            Optional<Long> viaRequest = paymentRequestRepository.findByCheckoutId(payment.getCheckoutId())
                    .map(PaymentRequest::getBookingId);
            if (viaRequest.isPresent()) {
                return new LinkageResult.Linked(viaRequest.get(), LinkConfidence.EXPLICIT);
            }
        }

        try {
            return legacyBookingMatcher.match(payment)
                    .<LinkageResult>map(b -> new LinkageResult.Linked(b.getId(), LinkConfidence.INFERRED))
                    .orElseGet(() -> new LinkageResult.Unlinked(LinkageResult.UnlinkedReason.NO_CANDIDATE, null));
        } catch (LinkageAmbiguousException e) {
            log.warn("Payment {} left unlinked for manual review: {}", payment.getId(), e.getMessage());
            return new LinkageResult.Unlinked(LinkageResult.UnlinkedReason.AMBIGUOUS, e.getCandidateBookingIds());
        }
    }

    /**
     * Attaches {@code booking} to a payment request that has none.
     *
     * @throws LinkageConflictException if the request belongs to another customer or already
     *                                  points at a different booking
     */
    @Transactional
    public PaymentRequest linkPaymentRequest(PaymentRequest paymentRequest, Booking booking) {
        if (!Objects.equals(paymentRequest.getCustomerId(), booking.getCustomerId())) {
            throw new LinkageConflictException(String.format(
                    "Booking %d belongs to customer %d, payment request %d to customer %d",
                    booking.getId(), booking.getCustomerId(), paymentRequest.getId(), paymentRequest.getCustomerId()));
        }

        paymentRequestRepository.assignBookingIfAbsent(paymentRequest.getId(), booking.getId());
        PaymentRequest current = paymentRequestRepository.findById(paymentRequest.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", paymentRequest.getId()));

        if (!Objects.equals(current.getBookingId(), booking.getId())) {
            throw new LinkageConflictException(String.format(
                    "Payment request %d is already linked to booking %d",
                    current.getId(), current.getBookingId()));
        }

        auditTrail.linked("PaymentRequest", current.getId(), current.getCustomerId(), booking.getId(), "admin");
        return current;
    }

    /**
     * Records the payment for a request that just became paid. Idempotent per checkout id.
     */
    @Transactional
    public Payment recordCompletedPayment(PaymentRequest request, ProcessorEvent event) {
        Optional<Payment> existing = paymentRepository.findByCheckoutId(request.getCheckoutId());
        if (existing.isPresent()) {
            log.info("Payment for checkout {} already recorded as {}", request.getCheckoutId(), existing.get().getId());
            return existing.get();
        }

        String serviceName = request.getBookingId() == null ? null
                : bookingRepository.findById(request.getBookingId()).map(Booking::getServiceName).orElse(null);
        String customerName = customerNameResolver.displayName(request.getCustomerId());
        LocalDateTime now = LocalDateTime.now();

        Payment payment = paymentRepository.save(Payment.builder()
                .bookingId(request.getBookingId())
                .linkConfidence(request.getBookingId() == null ? null : LinkConfidence.EXPLICIT)
                .customerId(request.getCustomerId())
                .checkoutId(request.getCheckoutId())
                .amount(event.getAmount() != null ? event.getAmount() : request.getAmount())
                .currency(event.getCurrency() != null ? event.getCurrency() : request.getCurrency())
                .status(PaymentStatus.PAID)
                .paymentMethod(PAYMENT_METHOD)
                .externalTransactionId(event.getTransactionId() != null ? event.getTransactionId()
                        : request.getCheckoutId())
                .processedAt(event.getOccurredAt() != null ? event.getOccurredAt() : now)
                .webhookProcessedAt(now)
                .eventType(event.getEventType())
                .eventId(event.getEventId())
                .notes(paymentNote(customerName, serviceName, event.getEventType()))
                .build());

        if (payment.getBookingId() == null) {
            log.warn("Payment {} for legacy payment request {} has no booking, left for backfill",
                    payment.getId(), request.getId());
        } else {
            log.info("Recorded payment {} for booking {} (checkout {})",
                    payment.getId(), payment.getBookingId(), payment.getCheckoutId());
        }
        return payment;
    }

    /**
     * Applies the legacy fallback to every payment without a booking. Ambiguous payments are
     * reported for manual review and left untouched.
     */
    public BackfillReport backfillLegacyPayments() {
        BackfillReport report = BackfillReport.builder().build();

        for (Payment payment : paymentRepository.findByBookingIdIsNullOrderByIdAsc()) {
            report.setExamined(report.getExamined() + 1);
            LinkageResult result = resolveBookingId(payment);

            if (result.isLinked()) {
                LinkageResult.Linked linked = (LinkageResult.Linked) result;
                if (paymentRepository.assignBookingIfAbsent(payment.getId(), linked.bookingId(),
                        linked.confidence()) == 1) {
                    report.setLinked(report.getLinked() + 1);
                    auditTrail.linked("Payment", payment.getId(), payment.getCustomerId(), linked.bookingId(),
                            "backfill:" + linked.confidence());
                    continue;
                }
            }

            report.setUnlinked(report.getUnlinked() + 1);
            if (!result.isLinked()
                    && ((LinkageResult.Unlinked) result).reason() == LinkageResult.UnlinkedReason.AMBIGUOUS) {
                report.getNeedsReview().add(payment.getId());
            }
        }

        log.info("Legacy payment backfill: examined={}, linked={}, unlinked={}, needsReview={}",
                report.getExamined(), report.getLinked(), report.getUnlinked(), report.getNeedsReview());
        return report;
    }

    private static String paymentNote(String customerName, String serviceName, String eventType) {
        StringBuilder note = new StringBuilder("Paid by ").append(customerName);
        if (serviceName != null) {
            note.append(" for ").append(serviceName);
        }
        return note.append(" (").append(eventType).append(')').toString();
    }
}
