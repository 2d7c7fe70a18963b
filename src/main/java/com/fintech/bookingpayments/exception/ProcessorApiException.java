package com.fintech.bookingpayments.exception;

/**
 * Thrown when a lookup against the payment processor's API fails.
 * This could be due to network issues, an error response or an open circuit.
 */
public class ProcessorApiException extends PaymentReconciliationException {

    private final String processorName;
    private final String checkoutId;
    private final boolean retryable;

    public ProcessorApiException(String message, String processorName, String checkoutId, boolean retryable) {
        super(message);
        this.processorName = processorName;
        this.checkoutId = checkoutId;
        this.retryable = retryable;
    }

    public ProcessorApiException(String message, String processorName, String checkoutId, boolean retryable,
                                 Throwable cause) {
        super(message, cause);
        this.processorName = processorName;
        this.checkoutId = checkoutId;
        this.retryable = retryable;
    }

    public String getProcessorName() {
        return processorName;
    }

    public String getCheckoutId() {
        return checkoutId;
    }

    /**
     * Transient errors (5xx, connection resets) are retryable. Client errors are not.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
