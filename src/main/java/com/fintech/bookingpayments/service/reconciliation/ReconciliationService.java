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
import com.fintech.bookingpayments.service.event.PaymentEventProcessor;
import com.fintech.bookingpayments.service.event.ProcessorEvent;
import com.fintech.bookingpayments.service.event.ProcessorEventMapper;
import com.fintech.bookingpayments.service.processor.PaymentProcessorClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Slow path for missed webhooks: asks the processor about sent requests that have not changed for a
 * while and applies what it reports through the same event path webhooks use.
 * <p>
 * A tick is idempotent and safe to overlap with another tick. Poller events carry deterministic ids
 * in the {@code poll:} namespace, so a second tick seeing the same news replays the ledger entry,
 * and every status change is a conditional update. Errors never leave a tick; they end up in the
 * returned summary and the request is looked at again on the next tick.
 */
@Service
@Slf4j
public class ReconciliationService {

    private static final int MAX_PAGES = 10_000;

    private final PaymentRequestRepository paymentRequestRepository;
    private final PaymentProcessorClient processorClient;
    private final ProcessorEventMapper eventMapper;
    private final PaymentEventProcessor eventProcessor;
    private final PaymentProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter examinedCounter;
    private Counter repairedCounter;
    private Counter processorErrorCounter;
    private Counter timeoutCounter;
    private Timer reconciliationTimer;

    public ReconciliationService(PaymentRequestRepository paymentRequestRepository,
                                 PaymentProcessorClient processorClient,
                                 ProcessorEventMapper eventMapper,
                                 PaymentEventProcessor eventProcessor,
                                 PaymentProperties properties,
                                 MeterRegistry meterRegistry) {
        this.paymentRequestRepository = paymentRequestRepository;
        this.processorClient = processorClient;
        this.eventMapper = eventMapper;
        this.eventProcessor = eventProcessor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        examinedCounter = Counter.builder("reconciliation.requests.examined")
                .description("Stale sent payment requests checked with the processor")
                .register(meterRegistry);

        repairedCounter = Counter.builder("reconciliation.requests.repaired")
                .description("Payment requests moved to a terminal status by the poller")
                .register(meterRegistry);

        processorErrorCounter = Counter.builder("reconciliation.processor.errors")
                .description("Failed checkout lookups")
                .register(meterRegistry);

        timeoutCounter = Counter.builder("reconciliation.processor.timeouts")
                .description("Checkout lookups that timed out")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete reconciliation run")
                .register(meterRegistry);
    }

    /**
     * One reconciliation tick.
     *
     * @param now reference time for staleness and expiry
     * @return statistics about the tick
     */
    public ReconciliationResult reconcileOnce(LocalDateTime now) {
        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(LocalDateTime.now())
                .build();

        log.info("Starting reconciliation of stale sent payment requests");

        return reconciliationTimer.record(() -> {
            processAllStaleRequests(now, result);
            result.setCompletedAt(LocalDateTime.now());

            log.info("Reconciliation completed. Examined: {}, Paid: {}, Expired: {}, Already resolved: {}, " +
                            "Still pending: {}, Failures recorded: {}, Timeouts: {}, Errors: {}",
                    result.getExamined(),
                    result.getMarkedPaid(),
                    result.getExpired(),
                    result.getAlreadyResolved(),
                    result.getStillPending(),
                    result.getFailuresRecorded(),
                    result.getTimeouts(),
                    result.getErrors());

            return result;
        });
    }

    private void processAllStaleRequests(LocalDateTime now, ReconciliationResult result) {
        PaymentProperties.Reconciliation config = properties.getReconciliation();
        LocalDateTime updatedBefore = now.minus(config.getStaleThreshold());
        long afterId = 0L;
        int pages = 0;
        List<PaymentRequest> batch;

        do {
            batch = paymentRequestRepository.findStaleForReconciliation(
                    PaymentRequestStatus.SENT,
                    updatedBefore,
                    config.getMaxFailures(),
                    afterId,
                    PageRequest.of(0, config.getBatchSize())
            );

            log.debug("Processing batch {} with {} payment requests", pages, batch.size());

            for (PaymentRequest request : batch) {
                processRequest(request, now, result);
                afterId = request.getId();
            }

            if (++pages >= MAX_PAGES) {
                log.warn("Reached maximum page limit ({}), stopping reconciliation", MAX_PAGES);
                break;
            }
        } while (batch.size() == config.getBatchSize());
    }

    private void processRequest(PaymentRequest request, LocalDateTime now, ReconciliationResult result) {
        result.incrementExamined();
        examinedCounter.increment();

        try {
            reconcileRequest(request, now, result);
        } catch (ExternalTimeoutException e) {
            log.warn("Processor lookup timed out for payment request {}, retrying next tick", request.getId());
            timeoutCounter.increment();
            result.incrementTimeouts();
            recordTransientError(request, e.getMessage());
        } catch (ProcessorApiException e) {
            log.warn("Processor API error for payment request {}: {}", request.getId(), e.getMessage());
            processorErrorCounter.increment();
            result.addError(request.getId(), request.getCheckoutId(), e.getMessage());
            if (e.isRetryable()) {
                // outage or open circuit, says nothing about this request
                recordTransientError(request, e.getMessage());
            } else {
                recordFailure(request, e.getMessage());
            }
        } catch (Exception e) {
            log.error("Unexpected error reconciling payment request {}: {}", request.getId(), e.getMessage(), e);
            result.addError(request.getId(), request.getCheckoutId(), "Unexpected error: " + e.getMessage());
            recordFailure(request, "Unexpected error: " + e.getMessage());
        }
    }

    private void reconcileRequest(PaymentRequest request, LocalDateTime now, ReconciliationResult result) {
        if (request.getCheckoutId() == null) {
            log.warn("Payment request {} is sent but has no checkout id", request.getId());
            result.addError(request.getId(), null, "Sent request without checkout id");
            recordFailure(request, "Sent request without checkout id");
            return;
        }

        CheckoutStatusResponse response = processorClient.getCheckoutStatus(request.getCheckoutId());
        Optional<ProcessorEvent> event = eventMapper.fromCheckoutStatus(
                request, response, now, properties.getReconciliation().getExpireAfter());

        if (event.isEmpty()) {
            if (response.getStatus() == CheckoutStatus.NOT_FOUND) {
                log.warn("Checkout {} of payment request {} not found at {}",
                        request.getCheckoutId(), request.getId(), processorClient.getProcessorName());
                result.addError(request.getId(), request.getCheckoutId(), "Checkout not found at processor");
                recordFailure(request, "Checkout not found at processor");
            } else {
                log.debug("Payment request {} still {} at processor", request.getId(), response.getStatus());
                recordSuccess(request);
                result.incrementStillPending();
            }
            return;
        }

        EventProcessingResult outcome = eventProcessor.process(event.get());
        recordSuccess(request);
        classify(outcome, result);
    }

    private void classify(EventProcessingResult outcome, ReconciliationResult result) {
        EventOutcome eventOutcome = outcome.getOutcome();

        if (eventOutcome == EventOutcome.REJECTED || (outcome.isReplayed() && eventOutcome == EventOutcome.APPLIED)) {
            result.incrementAlreadyResolved();
        } else if (eventOutcome == EventOutcome.APPLIED) {
            repairedCounter.increment();
            if (outcome.getPaymentRequestStatus() == PaymentRequestStatus.PAID) {
                result.incrementMarkedPaid();
            } else {
                result.incrementExpired();
            }
        } else if (eventOutcome == EventOutcome.FAILURE_RECORDED && !outcome.isReplayed()) {
            result.incrementFailuresRecorded();
        } else {
            result.incrementStillPending();
        }
    }

    private void recordSuccess(PaymentRequest request) {
        bookkeeping(request, () -> paymentRequestRepository.recordReconciliationSuccess(
                request.getId(), LocalDateTime.now()));
    }

    private void recordFailure(PaymentRequest request, String error) {
        bookkeeping(request, () -> paymentRequestRepository.recordReconciliationFailure(
                request.getId(), LocalDateTime.now(), truncate(error)));
    }

    private void recordTransientError(PaymentRequest request, String error) {
        bookkeeping(request, () -> paymentRequestRepository.recordTransientReconciliationError(
                request.getId(), LocalDateTime.now(), truncate(error)));
    }

    private void bookkeeping(PaymentRequest request, Runnable update) {
        try {
            update.run();
        } catch (Exception e) {
            log.error("Failed to save reconciliation state for payment request {}", request.getId(), e);
        }
    }

    private static String truncate(String message) {
        return message != null && message.length() > 500 ? message.substring(0, 500) : message;
    }

    /**
     * Current request counts per status, plus the number of requests waiting for manual review.
     */
    public ReconciliationStats getStats() {
        return ReconciliationStats.builder()
                .pendingCount(paymentRequestRepository.countByStatus(PaymentRequestStatus.PENDING))
                .sentCount(paymentRequestRepository.countByStatus(PaymentRequestStatus.SENT))
                .paidCount(paymentRequestRepository.countByStatus(PaymentRequestStatus.PAID))
                .cancelledCount(paymentRequestRepository.countByStatus(PaymentRequestStatus.CANCELLED))
                .expiredCount(paymentRequestRepository.countByStatus(PaymentRequestStatus.EXPIRED))
                .needsReviewCount(findNeedingManualReview().size())
                .build();
    }

    /**
     * Sent requests the poller gave up on after too many failed lookups.
     */
    public List<PaymentRequest> findNeedingManualReview() {
        return paymentRequestRepository.findNeedingManualReview(
                PaymentRequestStatus.SENT, properties.getReconciliation().getMaxFailures());
    }

    /**
     * Clears the failure count of a request parked for manual review so the next tick looks at it again.
     */
    public PaymentRequest resetManualReview(Long paymentRequestId) {
        PaymentRequest request = paymentRequestRepository.findById(paymentRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", paymentRequestId));
        if (paymentRequestRepository.resetReconciliationFailures(paymentRequestId) > 0) {
            log.info("Reset reconciliation failures of payment request {} (was {})",
                    paymentRequestId, request.getReconciliationFailures());
            return paymentRequestRepository.findById(paymentRequestId).orElse(request);
        }
        return request;
    }

    @lombok.Data
    @lombok.Builder
    public static class ReconciliationStats {
        private long pendingCount;
        private long sentCount;
        private long paidCount;
        private long cancelledCount;
        private long expiredCount;
        private long needsReviewCount;
    }
}
