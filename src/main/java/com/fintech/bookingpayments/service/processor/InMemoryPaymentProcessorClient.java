package com.fintech.bookingpayments.service.processor;

import com.fintech.bookingpayments.dto.CheckoutStatusResponse;
import com.fintech.bookingpayments.dto.CheckoutStatusResponse.CheckoutStatus;
import com.fintech.bookingpayments.exception.ExternalTimeoutException;
import com.fintech.bookingpayments.exception.ProcessorApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Processor stand-in holding checkouts in memory.
 * <p>
 * Used in sandbox deployments and tests. Outages and timeouts can be switched on to exercise the
 * poller's error handling.
 */
@Service
@ConditionalOnProperty(name = "payment.processor.mode", havingValue = "in-memory")
@Slf4j
public class InMemoryPaymentProcessorClient implements PaymentProcessorClient {

    private static final String PROCESSOR_NAME = "InMemoryProcessor";

    private final Map<String, CheckoutStatusResponse> checkouts = new ConcurrentHashMap<>();

    @Value("${processor.in-memory.latency-ms:0}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;
    private volatile boolean simulateTimeout = false;

    @Override
    public CheckoutStatusResponse getCheckoutStatus(String checkoutId) throws ProcessorApiException {
        simulateLatency();

        if (simulateTimeout) {
            throw new ExternalTimeoutException(PROCESSOR_NAME, checkoutId,
                    new SocketTimeoutException("Read timed out"));
        }
        if (simulateOutage) {
            throw new ProcessorApiException("Processor API is currently unavailable",
                    PROCESSOR_NAME, checkoutId, true);
        }

        CheckoutStatusResponse response = checkouts.get(checkoutId);
        if (response == null) {
            log.warn("Checkout not found in processor: {}", checkoutId);
            return CheckoutStatusResponse.builder()
                    .checkoutId(checkoutId)
                    .status(CheckoutStatus.NOT_FOUND)
                    .build();
        }
        return response;
    }

    @Override
    public String getProcessorName() {
        return PROCESSOR_NAME;
    }

    public void registerCheckout(String checkoutId, CheckoutStatus status, BigDecimal amount, String currency) {
        checkouts.put(checkoutId, CheckoutStatusResponse.builder()
                .checkoutId(checkoutId)
                .status(status)
                .amount(amount)
                .currency(currency)
                .transactionCode(status == CheckoutStatus.PAID ? "TX-" + checkoutId : null)
                .processedAt(status == CheckoutStatus.PAID ? LocalDateTime.now() : null)
                .build());
    }

    /**
     * Changes a registered checkout's status, as the processor would after customer action.
     */
    public void updateStatus(String checkoutId, CheckoutStatus status) {
        CheckoutStatusResponse existing = checkouts.get(checkoutId);
        if (existing != null) {
            registerCheckout(checkoutId, status, existing.getAmount(), existing.getCurrency());
        }
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Processor outage simulation set to: {}", outage);
    }

    public void setSimulateTimeout(boolean timeout) {
        this.simulateTimeout = timeout;
        log.info("Processor timeout simulation set to: {}", timeout);
    }

    public void clear() {
        checkouts.clear();
        simulateOutage = false;
        simulateTimeout = false;
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
