package com.fintech.bookingpayments.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one reconciliation tick. Errors inside a tick end up here instead of being thrown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /**
     * Stale sent requests looked at.
     */
    @Builder.Default
    private int examined = 0;

    /**
     * Requests moved to a terminal status by this tick (paid or expired).
     */
    @Builder.Default
    private int repaired = 0;

    @Builder.Default
    private int markedPaid = 0;

    @Builder.Default
    private int expired = 0;

    /**
     * Processor had news, but a concurrent webhook or cancellation got there first.
     */
    @Builder.Default
    private int alreadyResolved = 0;

    @Builder.Default
    private int stillPending = 0;

    @Builder.Default
    private int failuresRecorded = 0;

    @Builder.Default
    private int timeouts = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private Long paymentRequestId;
        private String checkoutId;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementExamined() {
        this.examined++;
    }

    public void incrementMarkedPaid() {
        this.markedPaid++;
        this.repaired++;
    }

    public void incrementExpired() {
        this.expired++;
        this.repaired++;
    }

    public void incrementAlreadyResolved() {
        this.alreadyResolved++;
    }

    public void incrementStillPending() {
        this.stillPending++;
    }

    public void incrementFailuresRecorded() {
        this.failuresRecorded++;
    }

    public void incrementTimeouts() {
        this.timeouts++;
    }

    public void addError(Long paymentRequestId, String checkoutId, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .paymentRequestId(paymentRequestId)
                .checkoutId(checkoutId)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }
}
