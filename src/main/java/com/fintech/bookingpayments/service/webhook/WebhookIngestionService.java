package com.fintech.bookingpayments.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.bookingpayments.dto.EventProcessingResult;
import com.fintech.bookingpayments.dto.WebhookEnvelope;
import com.fintech.bookingpayments.exception.MalformedWebhookException;
import com.fintech.bookingpayments.exception.WebhookAuthenticationException;
import com.fintech.bookingpayments.service.event.PaymentEventProcessor;
import com.fintech.bookingpayments.service.event.ProcessorEventMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for processor webhooks, real or simulated.
 * <p>
 * Authentication happens before anything is parsed or stored. Everything after that is delegated
 * to {@link PaymentEventProcessor}, the same path the reconciliation poller uses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ProcessorEventMapper eventMapper;
    private final PaymentEventProcessor eventProcessor;
    private final MeterRegistry meterRegistry;

    /**
     * @param rawBody   request body exactly as received; the signature covers these bytes
     * @param signature value of the signature header, may be null
     * @throws WebhookAuthenticationException if the signature does not match
     * @throws MalformedWebhookException      if the body is not a valid envelope
     */
    public EventProcessingResult ingest(String rawBody, String signature) {
        if (!signatureVerifier.verify(rawBody, signature)) {
            meterRegistry.counter("payments.webhooks.rejected", "reason", "signature").increment();
            log.warn("Rejected webhook with invalid or missing signature");
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }

        WebhookEnvelope envelope = parse(rawBody);
        log.debug("Received webhook {} of type {} for checkout {}",
                envelope.getEventId(), envelope.getEventType(), envelope.getCheckoutId());

        return eventProcessor.process(eventMapper.fromWebhook(envelope));
    }

    private WebhookEnvelope parse(String rawBody) {
        WebhookEnvelope envelope;
        try {
            envelope = objectMapper.readValue(rawBody, WebhookEnvelope.class);
        } catch (JsonProcessingException e) {
            meterRegistry.counter("payments.webhooks.rejected", "reason", "malformed").increment();
            throw new MalformedWebhookException("Webhook body is not a valid event envelope", e);
        }
        if (envelope == null) {
            throw new MalformedWebhookException("Webhook body is empty");
        }

        Set<ConstraintViolation<WebhookEnvelope>> violations = validator.validate(envelope);
        if (!violations.isEmpty()) {
            meterRegistry.counter("payments.webhooks.rejected", "reason", "malformed").increment();
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new MalformedWebhookException("Invalid event envelope: " + details);
        }
        return envelope;
    }
}
