package com.fintech.bookingpayments.entity;

/**
 * Who or what caused a payment request transition.
 */
public enum TransitionSource {
    WEBHOOK,
    POLLER,
    CUSTOMER,
    ADMIN,
    SYSTEM
}
