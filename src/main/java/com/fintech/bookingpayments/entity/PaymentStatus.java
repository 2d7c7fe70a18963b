package com.fintech.bookingpayments.entity;

/**
 * Status of captured money. Records written by this service are always {@code PAID};
 * the other values occur on imported and legacy rows.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED
}
