package com.fintech.bookingpayments.service.notification;

/**
 * Delivers payment notifications to customers (email, SMS). Throwing marks the outbox entry
 * for retry.
 */
public interface PaymentNotifier {

    void send(PaymentNotification notification);
}
