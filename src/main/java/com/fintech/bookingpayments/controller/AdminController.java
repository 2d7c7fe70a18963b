package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.dto.BackfillReport;
import com.fintech.bookingpayments.dto.CancellationResult;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.Payment;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.TransitionSource;
import com.fintech.bookingpayments.exception.ResourceNotFoundException;
import com.fintech.bookingpayments.repository.BookingRepository;
import com.fintech.bookingpayments.repository.PaymentRepository;
import com.fintech.bookingpayments.repository.PaymentRequestRepository;
import com.fintech.bookingpayments.service.PaymentCancellationService;
import com.fintech.bookingpayments.service.linkage.LinkageResolver;
import com.fintech.bookingpayments.service.linkage.LinkageResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Back-office operations. Failures are reported as errors, unlike the customer-facing endpoints.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Cancellation and booking linkage for the admin console")
public class AdminController {

    private final PaymentCancellationService cancellationService;
    private final LinkageResolver linkageResolver;
    private final PaymentRequestRepository paymentRequestRepository;
    private final PaymentRepository paymentRepository;
    private final BookingRepository bookingRepository;

    @Operation(summary = "Cancel a payment request (admin)")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cancelled, or already terminal"),
            @ApiResponse(responseCode = "404", description = "Payment request not found"),
            @ApiResponse(responseCode = "409", description = "Request kept changing concurrently")
    })
    @PostMapping("/payment-requests/{id}/cancel")
    public ResponseEntity<CancellationResult> cancel(
            @Parameter(description = "Payment request ID") @PathVariable Long id,
            @RequestBody(required = false) Map<String, String> body) {
        String reason = body == null ? null : body.get("reason");
        return ResponseEntity.ok(cancellationService.cancel(id, reason, TransitionSource.ADMIN));
    }

    @Operation(summary = "Link a legacy payment request to a booking")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Linked"),
            @ApiResponse(responseCode = "404", description = "Payment request or booking not found"),
            @ApiResponse(responseCode = "409", description = "Other customer, or already linked to another booking")
    })
    @PostMapping("/payment-requests/{id}/link")
    public ResponseEntity<PaymentRequest> link(
            @Parameter(description = "Payment request ID") @PathVariable Long id,
            @Parameter(description = "Booking ID") @RequestParam Long bookingId) {
        PaymentRequest request = paymentRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Payment request", id));
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        return ResponseEntity.ok(linkageResolver.linkPaymentRequest(request, booking));
    }

    @Operation(summary = "Resolve the booking of a payment",
            description = "Read only. Shows whether the link is explicit, inferred or missing.")
    @GetMapping("/payments/{id}/linkage")
    public ResponseEntity<LinkageResult> linkage(@Parameter(description = "Payment ID") @PathVariable Long id) {
        Payment payment = paymentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", id));
        return ResponseEntity.ok(linkageResolver.resolveBookingId(payment));
    }

    @Operation(summary = "Link legacy payments to bookings",
            description = "Best-effort matching by customer, creation time and service name. Ambiguous payments " +
                    "are listed for manual review.")
    @PostMapping("/linkage/backfill")
    public ResponseEntity<BackfillReport> backfill() {
        log.info("Legacy payment backfill triggered via API");
        return ResponseEntity.ok(linkageResolver.backfillLegacyPayments());
    }
}
