package com.fintech.bookingpayments.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkSentCommand {

    @NotBlank
    @Size(max = 100)
    @JsonProperty("checkout_id")
    private String checkoutId;
}
