package com.fintech.bookingpayments.service.audit;

public enum AuditAction {
    READ,
    CREATE,
    TRANSITION,
    TRANSITION_REJECTED,
    LINK
}
