package com.fintech.bookingpayments.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment configuration bound from the {@code payment.*} namespace.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "payment")
public class PaymentProperties {

    /**
     * Production or sandbox. Required.
     */
    @NotNull
    private PaymentEnvironment environment;

    @Valid
    private final Webhook webhook = new Webhook();

    @Valid
    private final Processor processor = new Processor();

    @Valid
    private final Reconciliation reconciliation = new Reconciliation();

    @Valid
    private final Linkage linkage = new Linkage();

    @Valid
    private final Notification notification = new Notification();

    private final Pii pii = new Pii();

    @Getter
    @Setter
    public static class Webhook {
        /**
         * Shared HMAC secret. An empty secret rejects every webhook.
         */
        private String secret;

        @NotBlank
        private String signatureHeader = "X-Payment-Signature";
    }

    @Getter
    @Setter
    public static class Processor {
        /**
         * {@code http} talks to the processor API, {@code in-memory} keeps checkouts in process.
         */
        @NotBlank
        private String mode = "http";

        private String baseUrl = "https://api.sumup.com";

        private String apiKey;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(3);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long retryDelayMs = 1000L;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        @Min(1)
        private int batchSize = 50;

        /**
         * Minimum age of {@code updated_at} before a sent request is checked with the processor.
         */
        @NotNull
        private Duration staleThreshold = Duration.ofMinutes(10);

        /**
         * Consecutive failed processor lookups after which a request needs manual review.
         */
        @Min(1)
        private int maxFailures = 5;

        /**
         * Age (from creation) after which an unpaid sent request is expired.
         */
        @NotNull
        private Duration expireAfter = Duration.ofHours(72);
    }

    @Getter
    @Setter
    public static class Linkage {
        @NotNull
        private Duration legacyWindow = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Notification {
        @Min(1)
        private int batchSize = 50;

        @Min(1)
        private int maxAttempts = 8;

        @NotNull
        private Duration baseBackoff = Duration.ofSeconds(5);

        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Pii {
        /**
         * Base64 encoded AES key (16, 24 or 32 bytes).
         */
        private String key;
    }
}
