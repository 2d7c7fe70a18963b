package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.service.webhook.SandboxEventSimulator;
import com.fintech.bookingpayments.service.webhook.SandboxEventSimulator.SimulatedOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Not registered in production, where these paths answer 404.
 */
@RestController
@RequestMapping("/api/v1/sandbox")
@ConditionalOnProperty(name = "payment.environment", havingValue = "sandbox")
@RequiredArgsConstructor
@Tag(name = "Sandbox", description = "Simulated processor events")
public class SandboxController {

    private final SandboxEventSimulator simulator;

    @Operation(summary = "Simulate a processor webhook for a payment request",
            description = "Sends a signed synthetic event through regular webhook processing.")
    @PostMapping("/payment-requests/{id}/simulate")
    public ResponseEntity<EventProcessingResult> simulate(
            @Parameter(description = "Payment request ID") @PathVariable Long id,
            @Parameter(description = "SUCCESS or FAILURE") @RequestParam(defaultValue = "SUCCESS")
            SimulatedOutcome outcome) {
        return ResponseEntity.ok(simulator.simulate(id, outcome));
    }
}
