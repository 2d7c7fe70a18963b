package com.fintech.bookingpayments.service.linkage;

import com.fintech.bookingpayments.dto.BackfillReport;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.EventSource;
import com.fintech.bookingpayments.entity.LinkConfidence;
import com.fintech.bookingpayments.entity.Payment;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.PaymentStatus;
import com.fintech.bookingpayments.exception.LinkageAmbiguousException;
import com.fintech.bookingpayments.exception.LinkageConflictException;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.PaymentRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.audit.AuditTrail;
import com.fintech.bookingpayments.service.event.EventIntent;
import com.fintech.bookingpayments.service.event.ProcessorEvent;
import com.fintech.bookingpayments.service.pii.CustomerNameResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkageResolverTest {

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private PaymentRequestRepository paymentRequestRepository;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private LegacyBookingMatcher legacyBookingMatcher;

    @Mock
    private CustomerNameResolver customerNameResolver;

    @Mock
    private AuditTrail auditTrail;

    private LinkageResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LinkageResolver(paymentRepository, paymentRequestRepository, bookingRepository,
                legacyBookingMatcher, customerNameResolver, auditTrail);
    }

    @Nested
    @DisplayName("resolveBookingId")
    class ResolveTests {

        @Test
        @DisplayName("Explicit booking id is returned as is and never re-matched")
        void explicitBookingWins() {
            Payment payment = Payment.builder().id(1L).bookingId(10L).linkConfidence(LinkConfidence.EXPLICIT).build();

            LinkageResult result = resolver.resolveBookingId(payment);

            assertThat(result).isEqualTo(new LinkageResult.Linked(10L, LinkConfidence.EXPLICIT));
            verifyNoInteractions(legacyBookingMatcher);
        }

        @Test
        @DisplayName("Booking is taken from the payment request sharing the checkout id")
        void viaPaymentRequest() {
            Payment payment = Payment.builder().id(1L).checkoutId("ck_1").build();
            when(paymentRequestRepository.findByCheckoutId("ck_1"))
                    .thenReturn(Optional.of(PaymentRequest.builder().id(5L).bookingId(11L).build()));

            assertThat(resolver.resolveBookingId(payment))
                    .isEqualTo(new LinkageResult.Linked(11L, LinkConfidence.EXPLICIT));
            verifyNoInteractions(legacyBookingMatcher);
        }

        @Test
        @DisplayName("Legacy match is tagged as inferred")
        void legacyMatchIsInferred() {
            Payment payment = Payment.builder().id(1L).customerId(7L).build();
            when(legacyBookingMatcher.match(payment)).thenReturn(Optional.of(Booking.builder().id(12L).build()));

            LinkageResult result = resolver.resolveBookingId(payment);

            assertThat(result.isLinked()).isTrue();
            assertThat(result).isEqualTo(new LinkageResult.Linked(12L, LinkConfidence.INFERRED));
        }

        @Test
        @DisplayName("Ambiguous legacy match stays unlinked with its candidates")
        void ambiguousStaysUnlinked() {
            Payment payment = Payment.builder().id(1L).customerId(7L).build();
            when(legacyBookingMatcher.match(payment)).thenThrow(new LinkageAmbiguousException(1L, List.of(3L, 4L)));

            LinkageResult result = resolver.resolveBookingId(payment);

            assertThat(result.isLinked()).isFalse();
            assertThat(result).isEqualTo(new LinkageResult.Unlinked(
                    LinkageResult.UnlinkedReason.AMBIGUOUS, List.of(3L, 4L)));
        }
    }

    @Nested
    @DisplayName("recordCompletedPayment")
    class RecordPaymentTests {

        @Test
        @DisplayName("Creates a paid payment carrying the request's booking")
        void createsPayment() {
            PaymentRequest request = paidRequest();
            when(paymentRepository.findByCheckoutId("ck_1")).thenReturn(Optional.empty());
            when(bookingRepository.findById(10L)).thenReturn(Optional.of(
                    Booking.builder().id(10L).serviceName("Massage").build()));
            when(customerNameResolver.displayName(100L)).thenReturn("Jane Doe");
            when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Payment payment = resolver.recordCompletedPayment(request, event("TX-9"));

            assertThat(payment.getBookingId()).isEqualTo(10L);
            assertThat(payment.getLinkConfidence()).isEqualTo(LinkConfidence.EXPLICIT);
            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(payment.getExternalTransactionId()).isEqualTo("TX-9");
            assertThat(payment.getEventId()).isEqualTo("e1");
            assertThat(payment.getEventType()).isEqualTo("checkout.completed");
            assertThat(payment.getWebhookProcessedAt()).isNotNull();
            assertThat(payment.getNotes()).isEqualTo("Paid by Jane Doe for Massage (checkout.completed)");
        }

        @Test
        @DisplayName("Checkout id stands in for a missing transaction id")
        void fallsBackToCheckoutId() {
            when(paymentRepository.findByCheckoutId("ck_1")).thenReturn(Optional.empty());
            when(bookingRepository.findById(10L)).thenReturn(Optional.empty());
            when(customerNameResolver.displayName(100L)).thenReturn("Customer #100");
            when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Payment payment = resolver.recordCompletedPayment(paidRequest(), event(null));

            assertThat(payment.getExternalTransactionId()).isEqualTo("ck_1");
        }

        @Test
        @DisplayName("Existing payment for the checkout is returned instead of a second one")
        void idempotentPerCheckout() {
            Payment existing = Payment.builder().id(55L).checkoutId("ck_1").build();
            when(paymentRepository.findByCheckoutId("ck_1")).thenReturn(Optional.of(existing));

            assertThat(resolver.recordCompletedPayment(paidRequest(), event("TX-9"))).isSameAs(existing);
            verify(paymentRepository, never()).save(any());
        }

        private PaymentRequest paidRequest() {
            return PaymentRequest.builder()
                    .id(1L)
                    .bookingId(10L)
                    .customerId(100L)
                    .amount(new BigDecimal("60.00"))
                    .currency("EUR")
                    .status(PaymentRequestStatus.PAID)
                    .checkoutId("ck_1")
                    .build();
        }

        private ProcessorEvent event(String transactionId) {
            return ProcessorEvent.builder()
                    .eventId("e1")
                    .source(EventSource.WEBHOOK)
                    .eventType("checkout.completed")
                    .checkoutId("ck_1")
                    .transactionId(transactionId)
                    .amount(new BigDecimal("60.00"))
                    .currency("EUR")
                    .intent(EventIntent.PAID)
                    .occurredAt(LocalDateTime.now())
                    .build();
        }
    }

    @Nested
    @DisplayName("linkPaymentRequest")
    class LinkTests {

        @Test
        @DisplayName("Booking of another customer is refused")
        void otherCustomerConflicts() {
            PaymentRequest request = PaymentRequest.builder().id(1L).customerId(100L).build();
            Booking booking = Booking.builder().id(10L).customerId(200L).build();

            assertThatThrownBy(() -> resolver.linkPaymentRequest(request, booking))
                    .isInstanceOf(LinkageConflictException.class);
            verify(paymentRequestRepository, never()).assignBookingIfAbsent(any(), any());
        }

        @Test
        @DisplayName("Existing different booking is never overwritten")
        void existingLinkConflicts() {
            PaymentRequest request = PaymentRequest.builder().id(1L).customerId(100L).build();
            Booking booking = Booking.builder().id(10L).customerId(100L).build();
            when(paymentRequestRepository.assignBookingIfAbsent(1L, 10L)).thenReturn(0);
            when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(
                    PaymentRequest.builder().id(1L).customerId(100L).bookingId(9L).build()));

            assertThatThrownBy(() -> resolver.linkPaymentRequest(request, booking))
                    .isInstanceOf(LinkageConflictException.class)
                    .hasMessageContaining("booking 9");
        }

        @Test
        @DisplayName("Absent booking is set and audited")
        void linksAbsentBooking() {
            PaymentRequest request = PaymentRequest.builder().id(1L).customerId(100L).build();
            Booking booking = Booking.builder().id(10L).customerId(100L).build();
            when(paymentRequestRepository.assignBookingIfAbsent(1L, 10L)).thenReturn(1);
            when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(
                    PaymentRequest.builder().id(1L).customerId(100L).bookingId(10L).build()));

            assertThat(resolver.linkPaymentRequest(request, booking).getBookingId()).isEqualTo(10L);
            verify(auditTrail).linked("PaymentRequest", 1L, 100L, 10L, "admin");
        }
    }

    @Test
    @DisplayName("Backfill links matched payments and reports ambiguous ones")
    void backfill() {
        Payment matched = Payment.builder().id(1L).customerId(7L).build();
        Payment ambiguous = Payment.builder().id(2L).customerId(7L).build();
        Payment unmatched = Payment.builder().id(3L).customerId(7L).build();
        when(paymentRepository.findByBookingIdIsNullOrderByIdAsc()).thenReturn(List.of(matched, ambiguous, unmatched));
        when(legacyBookingMatcher.match(matched)).thenReturn(Optional.of(Booking.builder().id(10L).build()));
        when(legacyBookingMatcher.match(ambiguous)).thenThrow(new LinkageAmbiguousException(2L, List.of(11L, 12L)));
        when(legacyBookingMatcher.match(unmatched)).thenReturn(Optional.empty());
        when(paymentRepository.assignBookingIfAbsent(1L, 10L, LinkConfidence.INFERRED)).thenReturn(1);

        BackfillReport report = resolver.backfillLegacyPayments();

        assertThat(report.getExamined()).isEqualTo(3);
        assertThat(report.getLinked()).isEqualTo(1);
        assertThat(report.getUnlinked()).isEqualTo(2);
        assertThat(report.getNeedsReview()).containsExactly(2L);

        ArgumentCaptor<Long> bookingCaptor = ArgumentCaptor.forClass(Long.class);
        verify(paymentRepository).assignBookingIfAbsent(eq(1L), bookingCaptor.capture(), eq(LinkConfidence.INFERRED));
        assertThat(bookingCaptor.getValue()).isEqualTo(10L);
    }
}
