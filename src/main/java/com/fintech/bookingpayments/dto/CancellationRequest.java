package com.fintech.bookingpayments.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancellationRequest {

    @NotNull
    @JsonProperty("payment_request_id")
    private Long paymentRequestId;

    @Size(max = 500)
    private String reason;
}
