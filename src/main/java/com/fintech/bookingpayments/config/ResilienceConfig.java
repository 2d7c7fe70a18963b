package com.fintech.bookingpayments.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker settings for calls to the payment processor's checkout API.
 * <p>
 * States:
 * - CLOSED: lookups pass through
 * - OPEN: processor is failing, lookups fail fast and the poller moves on
 * - HALF_OPEN: a few trial lookups decide whether to close again
 */
@Configuration
public class ResilienceConfig {

    public static final String PROCESSOR_API = "processorApi";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig processorConfig = CircuitBreakerConfig.custom()
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(4))
                .slowCallRateThreshold(80)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.addConfiguration(PROCESSOR_API, processorConfig);
        registry.circuitBreaker(PROCESSOR_API, processorConfig);
        return registry;
    }
}
