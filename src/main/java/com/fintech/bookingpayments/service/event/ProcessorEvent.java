package com.fintech.bookingpayments.service.event;

import com.fintech.bookingpayments.entity.EventSource;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A processor event normalised from either a webhook envelope or a poller lookup.
 * Both sources are processed by the same code from here on.
 */
@Value
@Builder
public class ProcessorEvent {

    String eventId;
    EventSource source;
    String eventType;
    String checkoutId;
    String transactionId;
    BigDecimal amount;
    String currency;
    String rawStatus;
    EventIntent intent;
    LocalDateTime occurredAt;
}
