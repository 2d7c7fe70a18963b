package com.fintech.bookingpayments.service;

import com.fintech.bookingpayments.dto.CreatePaymentRequestCommand;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.exception.InvalidTransitionException;
import com.fintech.bookingpayments.exception.PaymentRequestConflictException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import com.fintech.bookingpayments.service.state.PaymentRequestTransitionService;
import com.fintech.bookingpayments.service.state.TransitionEvidence;
import com.fintech.bookingpayments.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;

/**
 * Creation and hand-off of payment requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentRequestService {

    static final String SUPERSEDED_REASON = "Superseded by a new payment request";

    private final PaymentRequestRepository paymentRequestRepository;
    private final BookingRepository bookingRepository;
    private final PaymentRequestTransitionService transitionService;
    private final AuditTrail auditTrail;

    /**
     * Creates a pending request for the booking. Active requests on the same booking are cancelled
     * first; creation is refused if one of them turned out to be paid. Creation is serialized per
     * booking through a row lock.
     */
    @Transactional
    public PaymentRequest create(CreatePaymentRequestCommand command, String actor) {
        Booking booking = bookingRepository.findByIdForUpdate(command.getBookingId())
                .orElseThrow(() -> new ResourceNotFoundException("Booking", command.getBookingId()));

        List<PaymentRequest> active = paymentRequestRepository.findByBookingIdAndStatusIn(
                booking.getId(), EnumSet.of(PaymentRequestStatus.PENDING, PaymentRequestStatus.SENT));

        for (PaymentRequest previous : active) {
            TransitionResult result = transitionService.applyTransition(previous, PaymentRequestStatus.CANCELLED,
                    TransitionEvidence.system(SUPERSEDED_REASON));
            if (!result.isApplied() && result.getRequest().getStatus() == PaymentRequestStatus.PAID) {
                throw new PaymentRequestConflictException(String.format(
                        "Booking %d already has paid payment request %d", booking.getId(), previous.getId()));
            }
            if (!result.isApplied() && result.getRequest().getStatus().isActive()) {
                throw new PaymentRequestConflictException(String.format(
                        "Payment request %d of booking %d changed concurrently, retry", previous.getId(),
                        booking.getId()));
            }
            log.info("Superseded payment request {} of booking {}", previous.getId(), booking.getId());
        }

        PaymentRequest request = paymentRequestRepository.save(PaymentRequest.builder()
                .bookingId(booking.getId())
                .customerId(booking.getCustomerId())
                .amount(command.getAmount())
                .currency(command.getCurrency() != null ? command.getCurrency() : "EUR")
                .dueDate(command.getDueDate())
                .notes(command.getNotes())
                .checkoutId(command.getCheckoutId())
                .status(PaymentRequestStatus.PENDING)
                .build());

        log.info("Created payment request {} for booking {} ({} {})", request.getId(), booking.getId(),
                request.getAmount(), request.getCurrency());
        auditTrail.paymentRequestCreated(request, actor);
        return request;
    }

    /**
     * Records the processor checkout handed to the customer: {@code pending -> sent}.
     *
     * @throws InvalidTransitionException if the request is no longer pending
     */
    public PaymentRequest markSent(Long paymentRequestId, String checkoutId, String actor) {
        PaymentRequest request = load(paymentRequestId);
        TransitionResult result = transitionService.applyTransition(request, PaymentRequestStatus.SENT,
                TransitionEvidence.checkoutSent(checkoutId, actor));
        if (!result.isApplied()) {
            throw new InvalidTransitionException(paymentRequestId, result.getRequest().getStatus(),
                    PaymentRequestStatus.SENT);
        }
        return result.getRequest();
    }

    public PaymentRequest get(Long paymentRequestId, String actor) {
        PaymentRequest request = load(paymentRequestId);
        auditTrail.paymentRequestRead(request, actor);
        return request;
    }

    private PaymentRequest load(Long paymentRequestId) {
        return paymentRequestRepository.findById(paymentRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", paymentRequestId));
    }
}
