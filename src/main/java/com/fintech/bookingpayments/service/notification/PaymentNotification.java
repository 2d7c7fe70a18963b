package com.fintech.bookingpayments.service.notification;

import com.fintech.bookingpayments.entity.PaymentRequestFact;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Message handed to a {@link PaymentNotifier}. Built at delivery time and never persisted,
 * since it carries the customer's plaintext name.
 */
@Value
@Builder
public class PaymentNotification {

    String notificationId;
    PaymentRequestFact fact;
    Long paymentRequestId;
    PaymentRequestStatus requestStatus;
    Long customerId;
    String customerName;
    Long bookingId;
    String serviceName;
    BigDecimal amount;
    String currency;
}
