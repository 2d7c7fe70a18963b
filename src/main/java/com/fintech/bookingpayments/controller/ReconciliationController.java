package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.dto.ReconciliationResult;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.service.reconciliation.ReconciliationService;
import com.fintech.bookingpayments.service.reconciliation.ReconciliationService.ReconciliationStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * REST API for the reconciliation poller: trigger a tick, inspect counts, list stuck requests.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Missed-webhook repair via processor polling")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @Operation(
            summary = "Run one reconciliation tick",
            description = "Checks stale sent payment requests with the processor and applies missed outcomes. " +
                    "Safe to call while a scheduled tick is running."
    )
    @ApiResponse(responseCode = "200", description = "Tick completed",
            content = @Content(schema = @Schema(implementation = ReconciliationResult.class)))
    @PostMapping("/run")
    public ResponseEntity<ReconciliationResult> triggerReconciliation() {
        log.info("Manual reconciliation triggered via API");
        return ResponseEntity.ok(reconciliationService.reconcileOnce(LocalDateTime.now()));
    }

    @Operation(summary = "Get payment request counts per status")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconciliationStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconciliationStats> getStats() {
        return ResponseEntity.ok(reconciliationService.getStats());
    }

    @Operation(
            summary = "Get payment requests needing manual review",
            description = "Sent requests whose checkout lookups failed too often. The poller no longer picks them up."
    )
    @ApiResponse(responseCode = "200", description = "Requests needing review retrieved successfully")
    @GetMapping("/needs-review")
    public ResponseEntity<List<PaymentRequest>> getRequestsNeedingReview() {
        return ResponseEntity.ok(reconciliationService.findNeedingManualReview());
    }

    @Operation(summary = "Put a request needing review back into reconciliation")
    @ApiResponse(responseCode = "200", description = "Failure count cleared")
    @ApiResponse(responseCode = "404", description = "Payment request not found")
    @PostMapping("/needs-review/{id}/reset")
    public ResponseEntity<PaymentRequest> resetReview(@PathVariable Long id) {
        log.info("Manual review reset requested for payment request {}", id);
        return ResponseEntity.ok(reconciliationService.resetManualReview(id));
    }
}
