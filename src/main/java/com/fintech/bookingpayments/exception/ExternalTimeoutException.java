package com.fintech.bookingpayments.exception;

/**
 * The processor did not answer within the configured timeout.
 * The poller treats this as "no new information this tick", never as a payment failure.
 */
public class ExternalTimeoutException extends ProcessorApiException {

    public ExternalTimeoutException(String processorName, String checkoutId, Throwable cause) {
        super("Processor lookup timed out for checkout " + checkoutId, processorName, checkoutId, false, cause);
    }
}
