package com.fintech.bookingpayments.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * A checkout's current state as reported by the processor's status API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutStatusResponse {

    private String checkoutId;

    private CheckoutStatus status;

    /**
     * Amount confirmed by the processor.
     */
    private BigDecimal amount;

    private String currency;

    /**
     * Code of the transaction that settled the checkout, if any.
     */
    private String transactionCode;

    private LocalDateTime processedAt;

    /**
     * Processor-side checkout statuses.
     */
    public enum CheckoutStatus {
        /**
         * Customer has not completed the checkout yet.
         */
        PENDING,

        /**
         * Money captured.
         */
        PAID,

        /**
         * Last attempt failed. The customer may try again.
         */
        FAILED,

        /**
         * Customer abandoned the checkout at the processor. The request stays open.
         */
        CANCELLED,

        /**
         * The processor no longer accepts payment for this checkout.
         */
        EXPIRED,

        /**
         * Unknown to the processor.
         */
        NOT_FOUND;

        /**
         * Maps the processor's raw status string. Anything unrecognised is treated as still pending.
         */
        public static CheckoutStatus fromProcessorValue(String raw) {
            if (raw == null) {
                return PENDING;
            }
            return switch (raw.trim().toUpperCase(Locale.ROOT)) {
                case "PAID", "SUCCESSFUL" -> PAID;
                case "FAILED" -> FAILED;
                case "CANCELLED", "CANCELED" -> CANCELLED;
                case "EXPIRED" -> EXPIRED;
                default -> PENDING;
            };
        }
    }
}
