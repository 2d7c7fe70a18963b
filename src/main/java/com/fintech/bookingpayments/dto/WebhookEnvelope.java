package com.fintech.bookingpayments.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Event envelope pushed by the payment processor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookEnvelope {

    @NotBlank
    @Size(max = 200)
    @JsonProperty("event_id")
    private String eventId;

    @NotBlank
    @Size(max = 100)
    @JsonProperty("event_type")
    private String eventType;

    @NotBlank
    @Size(max = 100)
    @JsonProperty("checkout_id")
    private String checkoutId;

    /**
     * Processor transaction code, when the event carries one.
     */
    @Size(max = 100)
    @JsonProperty("transaction_id")
    private String transactionId;

    @PositiveOrZero
    @JsonProperty("amount")
    private BigDecimal amount;

    @Size(max = 3)
    @JsonProperty("currency")
    private String currency;

    @JsonProperty("status")
    private String status;

    @JsonProperty("occurred_at")
    private OffsetDateTime occurredAt;
}
