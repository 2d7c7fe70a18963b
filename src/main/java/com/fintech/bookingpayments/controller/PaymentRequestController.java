package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.dto.CancellationRequest;
import com.fintech.bookingpayments.dto.CancellationResult;
import com.fintech.bookingpayments.dto.CreatePaymentRequestCommand;
import com.fintech.bookingpayments.dto.MarkSentCommand;
import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.service.PaymentCancellationService;
import com.fintech.bookingpayments.service.PaymentRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/payment-requests")
@RequiredArgsConstructor
@Tag(name = "Payment requests", description = "Payment requests for bookings")
public class PaymentRequestController {

    private static final String ACTOR = "api";

    private final PaymentRequestService paymentRequestService;
    private final PaymentCancellationService cancellationService;

    @Operation(summary = "Create a payment request for a booking",
            description = "Active requests of the booking are cancelled first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Payment request created"),
            @ApiResponse(responseCode = "404", description = "Booking not found"),
            @ApiResponse(responseCode = "409", description = "Booking already paid")
    })
    @PostMapping
    public ResponseEntity<PaymentRequest> create(@Valid @RequestBody CreatePaymentRequestCommand command) {
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentRequestService.create(command, ACTOR));
    }

    @Operation(summary = "Get a payment request")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment request found"),
            @ApiResponse(responseCode = "404", description = "Payment request not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<PaymentRequest> get(@Parameter(description = "Payment request ID") @PathVariable Long id) {
        return ResponseEntity.ok(paymentRequestService.get(id, ACTOR));
    }

    @Operation(summary = "Record the processor checkout sent to the customer")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment request is now sent"),
            @ApiResponse(responseCode = "404", description = "Payment request not found"),
            @ApiResponse(responseCode = "409", description = "Payment request is not pending")
    })
    @PostMapping("/{id}/checkout")
    public ResponseEntity<PaymentRequest> markSent(@Parameter(description = "Payment request ID") @PathVariable Long id,
                                                   @Valid @RequestBody MarkSentCommand command) {
        return ResponseEntity.ok(paymentRequestService.markSent(id, command.getCheckoutId(), ACTOR));
    }

    @Operation(summary = "Cancel a payment request (customer)",
            description = "Always answers 200. The body tells whether the request was cancelled and its status.")
    @ApiResponse(responseCode = "200", description = "Cancellation attempted")
    @PostMapping("/cancel")
    public ResponseEntity<CancellationResult> cancel(@Valid @RequestBody CancellationRequest request) {
        return ResponseEntity.ok(cancellationService.cancelForCustomer(request.getPaymentRequestId(),
                request.getReason()));
    }
}
