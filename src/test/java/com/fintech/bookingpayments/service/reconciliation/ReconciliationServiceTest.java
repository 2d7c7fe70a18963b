package com.fintech.bookingpayments.service.reconciliation;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse.CheckoutStatus;
import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.dto.ReconciliationResult;
import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.exception.ExternalTimeoutException;
import com.fintech.bookingpayments.exception.ProcessorApiException;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.event.EventIntent;
import com.fintech.bookingpayments.service.event.PaymentEventProcessor;
import com.fintech.bookingpayments.service.event.ProcessorEvent;
import com.fintech.bookingpayments.service.event.ProcessorEventMapper;
import com.fintech.bookingpayments.service.processor.PaymentProcessorClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReconciliationService.
 * <p>
 * Tests cover:
 * - Classification of processor answers
 * - Timeouts versus failures
 * - Keyset batching
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    @Mock
    private PaymentRequestRepository paymentRequestRepository;

    @Mock
    private PaymentProcessorClient processorClient;

    @Mock
    private PaymentEventProcessor eventProcessor;

    private PaymentProperties properties;
    private ReconciliationService reconciliationService;
    private final LocalDateTime now = LocalDateTime.now();

    @BeforeEach
    void setUp() {
        properties = new PaymentProperties();
        properties.getReconciliation().setBatchSize(2);
        reconciliationService = new ReconciliationService(
                paymentRequestRepository,
                processorClient,
                new ProcessorEventMapper(),
                eventProcessor,
                properties,
                new SimpleMeterRegistry()
        );
        reconciliationService.initMetrics();
    }

    @Nested
    @DisplayName("Processor answers")
    class ProcessorAnswerTests {

        @Test
        @DisplayName("Paid checkout is applied through the event processor")
        void paidCheckoutIsApplied() {
            // Given
            PaymentRequest request = sentRequest(1L, "ck_1", now.minusHours(2));
            givenStale(request);
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.PAID));
            when(eventProcessor.process(any())).thenReturn(outcome(EventOutcome.APPLIED, PaymentRequestStatus.PAID, false));

            // When
            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            // Then
            assertThat(result.getExamined()).isEqualTo(1);
            assertThat(result.getMarkedPaid()).isEqualTo(1);
            assertThat(result.getRepaired()).isEqualTo(1);
            assertThat(result.getErrors()).isZero();

            ArgumentCaptor<ProcessorEvent> captor = ArgumentCaptor.forClass(ProcessorEvent.class);
            verify(eventProcessor).process(captor.capture());
            assertThat(captor.getValue().getEventId()).isEqualTo("poll:ck_1:paid");
            assertThat(captor.getValue().getIntent()).isEqualTo(EventIntent.PAID);
            verify(paymentRequestRepository).recordReconciliationSuccess(eq(1L), any());
        }

        @Test
        @DisplayName("Webhook that got there first counts as already resolved")
        void concurrentWebhookWins() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.PAID));
            when(eventProcessor.process(any())).thenReturn(outcome(EventOutcome.REJECTED, PaymentRequestStatus.CANCELLED, false));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getAlreadyResolved()).isEqualTo(1);
            assertThat(result.getRepaired()).isZero();
        }

        @Test
        @DisplayName("Pending checkout leaves the request untouched")
        void pendingCheckout() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.PENDING));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getStillPending()).isEqualTo(1);
            verifyNoInteractions(eventProcessor);
            verify(paymentRequestRepository).recordReconciliationSuccess(eq(1L), any());
        }

        @Test
        @DisplayName("Overdue unpaid request is expired")
        void overdueRequestExpires() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(80)));
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.PENDING));
            when(eventProcessor.process(any())).thenReturn(outcome(EventOutcome.APPLIED, PaymentRequestStatus.EXPIRED, false));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getExpired()).isEqualTo(1);
            assertThat(result.getRepaired()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown checkout counts as a failed lookup")
        void notFoundIsAFailure() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.NOT_FOUND));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getErrors()).isEqualTo(1);
            verify(paymentRequestRepository).recordReconciliationFailure(eq(1L), any(), contains("not found"));
        }
    }

    @Nested
    @DisplayName("Error handling")
    class ErrorHandlingTests {

        @Test
        @DisplayName("Timeout is no information: no failure is recorded and nothing is applied")
        void timeoutIsNoInformation() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(100)));
            when(processorClient.getCheckoutStatus("ck_1")).thenThrow(
                    new ExternalTimeoutException("Test", "ck_1", new SocketTimeoutException("Read timed out")));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getTimeouts()).isEqualTo(1);
            assertThat(result.getErrors()).isZero();
            assertThat(result.getExpired()).isZero();
            verifyNoInteractions(eventProcessor);
            verify(paymentRequestRepository).recordTransientReconciliationError(eq(1L), any(), any());
            verify(paymentRequestRepository, never()).recordReconciliationFailure(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Processor error is collected and the tick continues")
        void processorErrorDoesNotStopTick() {
            PaymentRequest failing = sentRequest(1L, "ck_1", now.minusHours(2));
            PaymentRequest paid = sentRequest(2L, "ck_2", now.minusHours(2));
            givenStale(failing, paid);
            when(processorClient.getCheckoutStatus("ck_1"))
                    .thenThrow(new ProcessorApiException("Service unavailable", "Test", "ck_1", true));
            when(processorClient.getCheckoutStatus("ck_2")).thenReturn(response("ck_2", CheckoutStatus.PAID));
            when(eventProcessor.process(any())).thenReturn(outcome(EventOutcome.APPLIED, PaymentRequestStatus.PAID, false));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getExamined()).isEqualTo(2);
            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getErrorDetails()).singleElement()
                    .satisfies(error -> assertThat(error.getCheckoutId()).isEqualTo("ck_1"));
            assertThat(result.getMarkedPaid()).isEqualTo(1);
            verify(paymentRequestRepository).recordTransientReconciliationError(eq(1L), any(), eq("Service unavailable"));
            verify(paymentRequestRepository, never()).recordReconciliationFailure(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Open circuit is reported but does not count toward manual review")
        void openCircuitIsNotAFailure() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1")).thenThrow(new ProcessorApiException(
                    "Processor API circuit breaker is open. Service temporarily unavailable.", "Test", "ck_1", true));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getErrors()).isEqualTo(1);
            verify(paymentRequestRepository).recordTransientReconciliationError(eq(1L), any(),
                    contains("circuit breaker is open"));
            verify(paymentRequestRepository, never()).recordReconciliationFailure(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Rejected lookup counts as a failure")
        void clientErrorCountsAsFailure() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1"))
                    .thenThrow(new ProcessorApiException("Unauthorized", "Test", "ck_1", false));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getErrors()).isEqualTo(1);
            verify(paymentRequestRepository).recordReconciliationFailure(eq(1L), any(), eq("Unauthorized"));
            verify(paymentRequestRepository, never()).recordTransientReconciliationError(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Unexpected exception is swallowed into the summary")
        void unexpectedErrorIsSummarised() {
            givenStale(sentRequest(1L, "ck_1", now.minusHours(2)));
            when(processorClient.getCheckoutStatus("ck_1")).thenReturn(response("ck_1", CheckoutStatus.PAID));
            when(eventProcessor.process(any())).thenThrow(new IllegalStateException("boom"));

            ReconciliationResult result = reconciliationService.reconcileOnce(now);

            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getErrorDetails().get(0).getErrorMessage()).contains("boom");
        }
    }

    @Nested
    @DisplayName("Manual review")
    class ManualReviewTests {

        @Test
        @DisplayName("Reset clears the failure count of a parked request")
        void resetClearsFailures() {
            PaymentRequest parked = sentRequest(1L, "ck_1", now.minusHours(2));
            parked.setReconciliationFailures(3);
            PaymentRequest cleared = sentRequest(1L, "ck_1", now.minusHours(2));
            when(paymentRequestRepository.findById(1L)).thenReturn(Optional.of(parked), Optional.of(cleared));
            when(paymentRequestRepository.resetReconciliationFailures(1L)).thenReturn(1);

            PaymentRequest result = reconciliationService.resetManualReview(1L);

            assertThat(result.getReconciliationFailures()).isZero();
            verify(paymentRequestRepository).resetReconciliationFailures(1L);
        }

        @Test
        @DisplayName("Unknown request is reported as not found")
        void resetUnknownRequest() {
            when(paymentRequestRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reconciliationService.resetManualReview(99L))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(paymentRequestRepository, never()).resetReconciliationFailures(anyLong());
        }
    }

    @Test
    @DisplayName("Batches are fetched by keyset until a short batch")
    void keysetPagination() {
        PaymentRequest first = sentRequest(1L, "ck_1", now.minusHours(2));
        PaymentRequest second = sentRequest(5L, "ck_5", now.minusHours(2));
        PaymentRequest third = sentRequest(9L, "ck_9", now.minusHours(2));
        when(paymentRequestRepository.findStaleForReconciliation(eq(PaymentRequestStatus.SENT), any(), anyInt(),
                eq(0L), any(Pageable.class))).thenReturn(List.of(first, second));
        when(paymentRequestRepository.findStaleForReconciliation(eq(PaymentRequestStatus.SENT), any(), anyInt(),
                eq(5L), any(Pageable.class))).thenReturn(List.of(third));
        when(processorClient.getCheckoutStatus(anyString())).thenReturn(response("x", CheckoutStatus.PENDING));

        ReconciliationResult result = reconciliationService.reconcileOnce(now);

        assertThat(result.getExamined()).isEqualTo(3);
        assertThat(result.getStillPending()).isEqualTo(3);
        verify(paymentRequestRepository, times(2)).findStaleForReconciliation(any(), any(), anyInt(), anyLong(),
                any(Pageable.class));
    }

    @Test
    @DisplayName("Staleness threshold is applied relative to the tick time")
    void staleThresholdRelativeToNow() {
        when(paymentRequestRepository.findStaleForReconciliation(any(), any(), anyInt(), anyLong(), any(Pageable.class)))
                .thenReturn(Collections.emptyList());

        reconciliationService.reconcileOnce(now);

        verify(paymentRequestRepository).findStaleForReconciliation(eq(PaymentRequestStatus.SENT),
                eq(now.minus(properties.getReconciliation().getStaleThreshold())),
                eq(properties.getReconciliation().getMaxFailures()), eq(0L), any(Pageable.class));
    }

    private void givenStale(PaymentRequest... requests) {
        when(paymentRequestRepository.findStaleForReconciliation(any(), any(), anyInt(), anyLong(), any(Pageable.class)))
                .thenReturn(List.of(requests));
    }

    private PaymentRequest sentRequest(Long id, String checkoutId, LocalDateTime createdAt) {
        return PaymentRequest.builder()
                .id(id)
                .bookingId(id * 10)
                .customerId(100L)
                .amount(new BigDecimal("45.00"))
                .status(PaymentRequestStatus.SENT)
                .checkoutId(checkoutId)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private CheckoutStatusResponse response(String checkoutId, CheckoutStatus status) {
        return CheckoutStatusResponse.builder()
                .checkoutId(checkoutId)
                .status(status)
                .amount(new BigDecimal("45.00"))
                .currency("EUR")
                .build();
    }

    private EventProcessingResult outcome(EventOutcome outcome, PaymentRequestStatus status, boolean replayed) {
        return EventProcessingResult.builder()
                .eventId("poll:test")
                .outcome(outcome)
                .paymentRequestId(1L)
                .paymentRequestStatus(status)
                .replayed(replayed)
                .build();
    }
}
