package com.fintech.bookingpayments.config;

/**
 * Deployment environment. Always configured explicitly, never derived from request data.
 */
public enum PaymentEnvironment {
    PRODUCTION,
    SANDBOX;

    public boolean isProduction() {
        return this == PRODUCTION;
    }
}
