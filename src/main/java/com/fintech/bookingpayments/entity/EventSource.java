package com.fintech.bookingpayments.entity;

/**
 * Origin of a ledger entry. Poller entries use the {@code poll:} event id namespace.
 */
public enum EventSource {
    WEBHOOK,
    POLLER
}
