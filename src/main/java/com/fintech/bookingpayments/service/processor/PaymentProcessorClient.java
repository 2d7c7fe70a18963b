package com.fintech.bookingpayments.service.processor;

import com.fintech.bookingpayments.dto.CheckoutStatusResponse;
import com.fintech.bookingpayments.exception.ExternalTimeoutException;
import com.fintech.bookingpayments.exception.ProcessorApiException;

/**
 * Read access to the payment processor's checkout status API.
 * <p>
 * {@link HttpPaymentProcessorClient} calls the real API; {@link InMemoryPaymentProcessorClient}
 * keeps checkouts in process for sandbox runs and tests.
 */
public interface PaymentProcessorClient {

    /**
     * Fetches the processor's view of a checkout. A checkout the processor does not know is
     * reported as {@code NOT_FOUND}, not as an exception.
     *
     * @throws ExternalTimeoutException if the processor did not answer in time
     * @throws ProcessorApiException    if the processor is unavailable or answered with an error
     */
    CheckoutStatusResponse getCheckoutStatus(String checkoutId) throws ProcessorApiException;

    /**
     * Used for logging and metrics.
     */
    String getProcessorName();
}
