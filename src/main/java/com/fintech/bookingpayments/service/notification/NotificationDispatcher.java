package com.fintech.bookingpayments.service.notification;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.NotificationOutbox;
import com.fintech.bookingpayments.entity.NotificationStatus;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.NotificationOutboxRepository;
import com.fintech.bookingpayments.service.pii.CustomerNameResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delivers outbox entries written by payment request transitions.
 * <ul>
 *   <li>Locks a batch of due NEW/RETRY rows so several instances never send the same one.</li>
 *   <li>Failed deliveries are retried with exponential backoff and jitter, and end up DEAD after
 *   {@code payment.notification.max-attempts}.</li>
 * </ul>
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final NotificationOutboxRepository outboxRepository;
    private final BookingRepository bookingRepository;
    private final CustomerNameResolver customerNameResolver;
    private final PaymentNotifier notifier;
    private final PaymentProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public NotificationDispatcher(NotificationOutboxRepository outboxRepository,
                                  BookingRepository bookingRepository,
                                  CustomerNameResolver customerNameResolver,
                                  PaymentNotifier notifier,
                                  PaymentProperties properties,
                                  MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.bookingRepository = bookingRepository;
        this.customerNameResolver = customerNameResolver;
        this.notifier = notifier;
        this.properties = properties;

        this.sentCounter = Counter.builder("payments.notifications.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("payments.notifications.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("payments.notifications.dead").register(meterRegistry);
    }

    /**
     * Sends one batch of due notifications.
     *
     * @return number of entries delivered
     */
    @Transactional
    public int dispatchBatch() {
        PaymentProperties.Notification config = properties.getNotification();

        List<NotificationOutbox> batch = outboxRepository.lockNextBatch(
                EnumSet.of(NotificationStatus.NEW, NotificationStatus.RETRY),
                LocalDateTime.now(),
                PageRequest.of(0, config.getBatchSize()));

        if (batch.isEmpty()) {
            return 0;
        }

        int sent = 0;
        int retry = 0;
        int dead = 0;

        for (NotificationOutbox entry : batch) {
            try {
                notifier.send(toNotification(entry));
                entry.markSent();
                sent++;
                sentCounter.increment();
            } catch (Exception e) {
                String error = safeError(e);

                if (entry.getAttemptCount() + 1 >= config.getMaxAttempts()) {
                    entry.markDead(error);
                    dead++;
                    deadCounter.increment();
                    log.error("Notification {} for payment request {} moved to DEAD after {} attempts: {}",
                            entry.getId(), entry.getPaymentRequestId(), entry.getAttemptCount(), error);
                } else {
                    entry.markRetry(error, computeBackoff(config.getBaseBackoff(), config.getMaxBackoff(),
                            entry.getAttemptCount() + 1));
                    retry++;
                    retryCounter.increment();
                    log.warn("Notification {} failed, attempt {} next at {}: {}",
                            entry.getId(), entry.getAttemptCount(), entry.getNextAttemptAt(), error);
                }
            }
            outboxRepository.save(entry);
        }

        log.info("Notification batch done. sent={} retry={} dead={}", sent, retry, dead);
        return sent;
    }

    private PaymentNotification toNotification(NotificationOutbox entry) {
        String serviceName = entry.getBookingId() == null ? null
                : bookingRepository.findById(entry.getBookingId()).map(Booking::getServiceName).orElse(null);

        return PaymentNotification.builder()
                .notificationId(entry.getId())
                .fact(entry.getFact())
                .paymentRequestId(entry.getPaymentRequestId())
                .requestStatus(entry.getRequestStatus())
                .customerId(entry.getCustomerId())
                .customerName(customerNameResolver.displayName(entry.getCustomerId()))
                .bookingId(entry.getBookingId())
                .serviceName(serviceName)
                .amount(entry.getAmount())
                .currency(entry.getCurrency())
                .build();
    }

    /**
     * base * 2^(attempt-1), capped at max, jittered by a factor in [0.5, 1.5).
     */
    static Duration computeBackoff(Duration base, Duration max, int attempt) {
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long capped = Math.min((long) (base.toMillis() * exp), max.toMillis());
        long withJitter = (long) (capped * (0.5 + ThreadLocalRandom.current().nextDouble()));
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private static String safeError(Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
