package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.EventSource;
import com.fintech.bookingpayments.entity.NotificationOutbox;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestFact;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.TransitionSource;
import com.fintech.bookingpayments.repository.NotificationOutboxRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentRequestTransitionServiceTest {

    @Mock
    private PaymentRequestRepository paymentRequestRepository;

    @Mock
    private NotificationOutboxRepository notificationOutboxRepository;

    @Mock
    private AuditTrail auditTrail;

    private PaymentRequestTransitionService transitionService;

    @BeforeEach
    void setUp() {
        transitionService = new PaymentRequestTransitionService(
                paymentRequestRepository, notificationOutboxRepository, auditTrail);
    }

    @Test
    @DisplayName("Applied transition writes the outbox fact and returns the stored request")
    void appliedTransitionEmitsFact() {
        // Given
        PaymentRequest snapshot = request(PaymentRequestStatus.SENT);
        PaymentRequest stored = request(PaymentRequestStatus.PAID);
        when(paymentRequestRepository.compareAndSetStatus(eq(1L), eq(PaymentRequestStatus.SENT),
                eq(PaymentRequestStatus.PAID), any(), eq(TransitionSource.WEBHOOK), eq("e1"),
                eq("ck_1"), any(), any(), isNull(), isNull())).thenReturn(1);
        when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(stored));

        // When
        TransitionResult result = transitionService.applyTransition(snapshot, PaymentRequestStatus.PAID,
                TransitionEvidence.forEvent(EventSource.WEBHOOK, "e1"));

        // Then
        assertThat(result.isApplied()).isTrue();
        assertThat(result.getPreviousStatus()).isEqualTo(PaymentRequestStatus.SENT);
        assertThat(result.getFact()).isEqualTo(PaymentRequestFact.PAYMENT_COMPLETED);
        assertThat(result.getRequest().getStatus()).isEqualTo(PaymentRequestStatus.PAID);

        ArgumentCaptor<NotificationOutbox> captor = ArgumentCaptor.forClass(NotificationOutbox.class);
        verify(notificationOutboxRepository).save(captor.capture());
        assertThat(captor.getValue().getFact()).isEqualTo(PaymentRequestFact.PAYMENT_COMPLETED);
        assertThat(captor.getValue().getPaymentRequestId()).isEqualTo(1L);
        verify(auditTrail).paymentRequestTransitioned(stored, PaymentRequestStatus.SENT,
                PaymentRequestStatus.PAID, "webhook:e1", true);
    }

    @Test
    @DisplayName("Lost compare-and-set reports the current status and writes nothing")
    void lostRaceIsRejected() {
        // Given: the snapshot says SENT but a cancellation already landed
        PaymentRequest snapshot = request(PaymentRequestStatus.SENT);
        when(paymentRequestRepository.compareAndSetStatus(anyLong(), any(), any(), any(), any(), any(),
                any(), any(), any(), any(), any())).thenReturn(0);
        when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(request(PaymentRequestStatus.CANCELLED)));

        // When
        TransitionResult result = transitionService.applyTransition(snapshot, PaymentRequestStatus.PAID,
                TransitionEvidence.forEvent(EventSource.POLLER, "poll:ck_1:paid"));

        // Then
        assertThat(result.isApplied()).isFalse();
        assertThat(result.getRequest().getStatus()).isEqualTo(PaymentRequestStatus.CANCELLED);
        assertThat(result.getFact()).isNull();
        verifyNoInteractions(notificationOutboxRepository);
    }

    @Test
    @DisplayName("Unreachable target is rejected without touching the database")
    void unreachableTargetIsRejected() {
        PaymentRequest snapshot = request(PaymentRequestStatus.PAID);

        TransitionResult result = transitionService.applyTransition(snapshot, PaymentRequestStatus.CANCELLED,
                TransitionEvidence.cancellation(TransitionSource.CUSTOMER, "customer", "changed my mind"));

        assertThat(result.isApplied()).isFalse();
        assertThat(result.getRequest()).isSameAs(snapshot);
        verifyNoInteractions(paymentRequestRepository, notificationOutboxRepository);
    }

    @Test
    @DisplayName("Cancellation stores the reason and emits a request-closed fact")
    void cancellationStoresReason() {
        PaymentRequest snapshot = request(PaymentRequestStatus.PENDING);
        when(paymentRequestRepository.compareAndSetStatus(eq(1L), eq(PaymentRequestStatus.PENDING),
                eq(PaymentRequestStatus.CANCELLED), any(), eq(TransitionSource.ADMIN), eq("admin"),
                any(), any(), isNull(), notNull(), eq("Duplicate booking"))).thenReturn(1);
        when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(request(PaymentRequestStatus.CANCELLED)));

        TransitionResult result = transitionService.applyTransition(snapshot, PaymentRequestStatus.CANCELLED,
                TransitionEvidence.cancellation(TransitionSource.ADMIN, "admin", "Duplicate booking"));

        assertThat(result.isApplied()).isTrue();
        assertThat(result.getFact()).isEqualTo(PaymentRequestFact.REQUEST_CLOSED);
    }

    @Test
    @DisplayName("Sending stores the checkout id from the evidence")
    void sendingStoresCheckoutId() {
        PaymentRequest snapshot = request(PaymentRequestStatus.PENDING);
        snapshot.setCheckoutId(null);
        when(paymentRequestRepository.compareAndSetStatus(eq(1L), eq(PaymentRequestStatus.PENDING),
                eq(PaymentRequestStatus.SENT), any(), eq(TransitionSource.ADMIN), eq("api"),
                eq("ck_new"), notNull(), isNull(), isNull(), isNull())).thenReturn(1);
        when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(request(PaymentRequestStatus.SENT)));

        TransitionResult result = transitionService.applyTransition(snapshot, PaymentRequestStatus.SENT,
                TransitionEvidence.checkoutSent("ck_new", "api"));

        assertThat(result.isApplied()).isTrue();
        assertThat(result.getFact()).isNull();
        verifyNoInteractions(notificationOutboxRepository);
    }

    private PaymentRequest request(PaymentRequestStatus status) {
        return PaymentRequest.builder()
                .id(1L)
                .bookingId(10L)
                .customerId(100L)
                .amount(new BigDecimal("50.00"))
                .status(status)
                .checkoutId("ck_1")
                .createdAt(LocalDateTime.now().minusHours(1))
                .updatedAt(LocalDateTime.now().minusMinutes(30))
                .version(0L)
                .build();
    }
}
