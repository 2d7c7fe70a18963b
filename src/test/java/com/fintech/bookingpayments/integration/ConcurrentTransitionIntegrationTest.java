package com.fintech.bookingpayments.integration;

import com.fintech.bookingpayments.dto.CancellationResult;
import com.fintech.bookingpayments.dto.CreatePaymentRequestCommand;
import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.NotificationOutboxRepository;
import com.fintech.bookingpayments.repository.PaymentRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.repository.WebhookEventRepository;
import com.fintech.bookingpayments.service.PaymentCancellationService;
import com.fintech.bookingpayments.service.PaymentRequestService;
import com.fintech.bookingpayments.service.webhook.WebhookIngestionService;
import com.fintech.bookingpayments.service.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Racing writers on one payment request: exactly one of them lands.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentTransitionIntegrationTest {

    @Autowired
    private PaymentRequestService paymentRequestService;

    @Autowired
    private PaymentCancellationService cancellationService;

    @Autowired
    private WebhookIngestionService ingestionService;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private PaymentRequestRepository paymentRequestRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @Autowired
    private NotificationOutboxRepository notificationOutboxRepository;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        webhookEventRepository.deleteAll();
        notificationOutboxRepository.deleteAll();
        paymentRepository.deleteAll();
        paymentRequestRepository.deleteAll();
        bookingRepository.deleteAll();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @RepeatedTest(5)
    @DisplayName("Paid webhook racing a customer cancellation: one wins, the other sees the result")
    void paidWebhookVersusCancellation() throws Exception {
        // Given
        PaymentRequest request = sentRequest("ck_race");
        String body = envelope("evt_race", "ck_race");
        CountDownLatch start = new CountDownLatch(1);

        // When
        Future<EventProcessingResult> webhook = executor.submit(() -> {
            start.await();
            return ingestionService.ingest(body, signatureVerifier.sign(body));
        });
        Future<CancellationResult> cancel = executor.submit(() -> {
            start.await();
            return cancellationService.cancelForCustomer(request.getId(), "Changed plans");
        });
        start.countDown();

        EventProcessingResult webhookResult = webhook.get(30, TimeUnit.SECONDS);
        CancellationResult cancelResult = cancel.get(30, TimeUnit.SECONDS);

        // Then
        PaymentRequest stored = paymentRequestRepository.findById(request.getId()).orElseThrow();
        boolean paid = webhookResult.getOutcome() == EventOutcome.APPLIED;

        assertThat(paid).isNotEqualTo(cancelResult.isCancelled());
        if (paid) {
            assertThat(stored.getStatus()).isEqualTo(PaymentRequestStatus.PAID);
            assertThat(cancelResult.getStatus()).isEqualTo(PaymentRequestStatus.PAID);
            assertThat(paymentRepository.countByCheckoutId("ck_race")).isEqualTo(1);
        } else {
            assertThat(stored.getStatus()).isEqualTo(PaymentRequestStatus.CANCELLED);
            assertThat(webhookResult.getOutcome()).isEqualTo(EventOutcome.REJECTED);
            assertThat(paymentRepository.countByCheckoutId("ck_race")).isZero();
        }
    }

    @Test
    @DisplayName("Concurrent deliveries of one event apply it once")
    void duplicateDeliveries() throws Exception {
        // Given
        PaymentRequest request = sentRequest("ck_dup");
        String body = envelope("evt_dup", "ck_dup");
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<EventProcessingResult>> deliveries = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            deliveries.add(() -> {
                start.await();
                return ingestionService.ingest(body, signatureVerifier.sign(body));
            });
        }

        // When
        List<Future<EventProcessingResult>> futures = new ArrayList<>();
        for (Callable<EventProcessingResult> delivery : deliveries) {
            futures.add(executor.submit(delivery));
        }
        start.countDown();

        List<EventProcessingResult> results = new ArrayList<>();
        for (Future<EventProcessingResult> future : futures) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }

        // Then
        assertThat(results).allSatisfy(r -> assertThat(r.getOutcome()).isEqualTo(EventOutcome.APPLIED));
        assertThat(results).filteredOn(r -> !r.isReplayed()).hasSize(1);
        assertThat(paymentRepository.countByCheckoutId("ck_dup")).isEqualTo(1);
        assertThat(paymentRequestRepository.findById(request.getId()).orElseThrow().getStatus())
                .isEqualTo(PaymentRequestStatus.PAID);
    }

    private PaymentRequest sentRequest(String checkoutId) {
        Booking booking = bookingRepository.save(Booking.builder().customerId(200L).serviceName("Massage").build());
        PaymentRequest request = paymentRequestService.create(CreatePaymentRequestCommand.builder()
                .bookingId(booking.getId())
                .amount(new BigDecimal("80.00"))
                .build(), "test");
        return paymentRequestService.markSent(request.getId(), checkoutId, "test");
    }

    private static String envelope(String eventId, String checkoutId) {
        return "{\"event_id\":\"" + eventId + "\",\"event_type\":\"checkout.completed\","
                + "\"checkout_id\":\"" + checkoutId + "\",\"amount\":80.00,\"currency\":\"EUR\",\"status\":\"PAID\"}";
    }
}
