package com.fintech.bookingpayments.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePaymentRequestCommand {

    @NotNull
    @JsonProperty("booking_id")
    private Long bookingId;

    @NotNull
    @DecimalMin(value = "0.01")
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$")
    private String currency;

    @JsonProperty("due_date")
    private LocalDate dueDate;

    @Size(max = 1000)
    private String notes;

    /** Processor checkout already opened for this booking; the request stays pending until sent. */
    @Size(max = 100)
    @JsonProperty("checkout_id")
    private String checkoutId;
}
