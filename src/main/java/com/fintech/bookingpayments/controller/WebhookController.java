package com.fintech.bookingpayments.controller;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.dto.ErrorResponse;
import com.fintech.bookingpayments.service.webhook.WebhookIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Processor event intake")
public class WebhookController {

    private final WebhookIngestionService ingestionService;
    private final PaymentProperties properties;

    @Operation(
            summary = "Receive a processor event",
            description = "Body is signed with HMAC-SHA256. Duplicates and events for unknown checkouts " +
                    "are acknowledged with 200 so the processor stops retrying."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event processed, replayed or recorded",
                    content = @Content(schema = @Schema(implementation = EventProcessingResult.class))),
            @ApiResponse(responseCode = "400", description = "Malformed envelope",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/payment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EventProcessingResult> receive(@RequestBody String rawBody, HttpServletRequest request) {
        String signature = request.getHeader(properties.getWebhook().getSignatureHeader());
        return ResponseEntity.ok(ingestionService.ingest(rawBody, signature));
    }
}
