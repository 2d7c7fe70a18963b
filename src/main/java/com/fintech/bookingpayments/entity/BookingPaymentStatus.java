package com.fintech.bookingpayments.entity;

public enum BookingPaymentStatus {
    UNPAID,
    PAID
}
