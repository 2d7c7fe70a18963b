package com.fintech.bookingpayments.entity;

public enum NotificationStatus {
    NEW,
    RETRY,
    SENT,
    DEAD
}
