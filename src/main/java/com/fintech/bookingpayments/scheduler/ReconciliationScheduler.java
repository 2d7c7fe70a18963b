package com.fintech.bookingpayments.scheduler;

import com.fintech.bookingpayments.dto.ReconciliationResult;
import com.fintech.bookingpayments.service.reconciliation.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Runs the reconciliation poller on a fixed delay.
 * <p>
 * The interval should stay well below the stale threshold so a missed webhook is repaired within
 * a few minutes. Ticks may also be triggered through the REST API while one is running.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${reconciliation.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval-ms:120000}")
    public void runScheduledReconciliation() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping reconciliation run");
            return;
        }

        log.info("Starting scheduled reconciliation at {}", LocalDateTime.now());

        try {
            ReconciliationResult result = reconciliationService.reconcileOnce(LocalDateTime.now());

            logResult(result);

            if (result.getExamined() > 0 && result.getErrors() > result.getExamined() * 0.1) {
                log.warn("High error rate detected in reconciliation: {} errors out of {} examined",
                        result.getErrors(), result.getExamined());
            }
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationResult result) {
        if (result.getExamined() == 0) {
            log.info("No stale payment requests to reconcile");
        } else {
            log.info("Reconciliation completed in {}ms: {} examined, {} repaired, {} timeouts, {} errors",
                    result.getDurationMs(),
                    result.getExamined(),
                    result.getRepaired(),
                    result.getTimeouts(),
                    result.getErrors());
        }
    }
}
