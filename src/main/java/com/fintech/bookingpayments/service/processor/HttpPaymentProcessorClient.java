package com.fintech.bookingpayments.service.processor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.bookingpayments.config.ResilienceConfig;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse.CheckoutStatus;
import com.fintech.bookingpayments.exception.ExternalTimeoutException;
import com.fintech.bookingpayments.exception.ProcessorApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Checkout status lookups against the processor's REST API.
 * <p>
 * Transient errors (5xx, 429, connection failures) are retried with exponential backoff. Timeouts
 * are not retried: the poller records them as "no information" and tries again on its next run.
 */
@Service
@ConditionalOnProperty(name = "payment.processor.mode", havingValue = "http", matchIfMissing = true)
@Slf4j
public class HttpPaymentProcessorClient implements PaymentProcessorClient {

    private static final String PROCESSOR_NAME = "SumUp";
    private static final String CHECKOUT_PATH = "/v0.1/checkouts/{checkoutId}";

    private final RestTemplate restTemplate;

    public HttpPaymentProcessorClient(@Qualifier("processorRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.PROCESSOR_API, fallbackMethod = "getCheckoutStatusFallback")
    @Retryable(
            retryFor = ProcessorApiException.class,
            noRetryFor = ExternalTimeoutException.class,
            exceptionExpression = "retryable",
            maxAttemptsExpression = "${payment.processor.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${payment.processor.retry-delay-ms:1000}", multiplier = 2)
    )
    public CheckoutStatusResponse getCheckoutStatus(String checkoutId) throws ProcessorApiException {
        log.debug("Fetching checkout status from processor for checkout: {}", checkoutId);

        CheckoutPayload payload;
        try {
            payload = restTemplate.getForObject(CHECKOUT_PATH, CheckoutPayload.class, checkoutId);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.warn("Checkout not found at processor: {}", checkoutId);
                return notFound(checkoutId);
            }
            throw new ProcessorApiException(
                    "Processor answered " + e.getStatusCode().value() + " for checkout lookup",
                    PROCESSOR_NAME, checkoutId, isTransient(e.getStatusCode()), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ExternalTimeoutException(PROCESSOR_NAME, checkoutId, e);
            }
            throw new ProcessorApiException("Could not reach processor: " + e.getMessage(),
                    PROCESSOR_NAME, checkoutId, true, e);
        } catch (RestClientException e) {
            throw new ProcessorApiException("Unreadable processor response: " + e.getMessage(),
                    PROCESSOR_NAME, checkoutId, false, e);
        }

        if (payload == null) {
            throw new ProcessorApiException("Empty processor response", PROCESSOR_NAME, checkoutId, true);
        }

        CheckoutStatusResponse response = payload.toResponse(checkoutId);
        log.debug("Processor returned status {} for checkout {}", response.getStatus(), checkoutId);
        return response;
    }

    /**
     * Invoked by the circuit breaker on any failure and when the circuit is open.
     */
    public CheckoutStatusResponse getCheckoutStatusFallback(String checkoutId, Throwable throwable) {
        if (throwable instanceof ProcessorApiException) {
            throw (ProcessorApiException) throwable;
        }
        log.warn("Circuit breaker open for processor lookup of checkout {}: {}", checkoutId, throwable.getMessage());
        throw new ProcessorApiException(
                "Processor API circuit breaker is open. Service temporarily unavailable.",
                PROCESSOR_NAME, checkoutId, true, throwable);
    }

    @Override
    public String getProcessorName() {
        return PROCESSOR_NAME;
    }

    private static boolean isTransient(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private static CheckoutStatusResponse notFound(String checkoutId) {
        return CheckoutStatusResponse.builder()
                .checkoutId(checkoutId)
                .status(CheckoutStatus.NOT_FOUND)
                .build();
    }

    /**
     * Wire shape of {@code GET /v0.1/checkouts/{id}}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CheckoutPayload {

        private String id;
        private String status;
        private BigDecimal amount;
        private String currency;
        private OffsetDateTime date;
        private List<TransactionPayload> transactions;

        CheckoutStatusResponse toResponse(String requestedCheckoutId) {
            TransactionPayload settled = transactions == null || transactions.isEmpty()
                    ? null : transactions.get(transactions.size() - 1);
            LocalDateTime processedAt = settled != null && settled.getTimestamp() != null
                    ? settled.getTimestamp().atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime()
                    : null;

            return CheckoutStatusResponse.builder()
                    .checkoutId(id != null ? id : requestedCheckoutId)
                    .status(CheckoutStatus.fromProcessorValue(status))
                    .amount(amount)
                    .currency(currency)
                    .transactionCode(settled == null ? null
                            : settled.getTransactionCode() != null ? settled.getTransactionCode() : settled.getId())
                    .processedAt(processedAt)
                    .build();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TransactionPayload {

        private String id;

        @JsonProperty("transaction_code")
        private String transactionCode;

        private String status;

        private OffsetDateTime timestamp;
    }
}
