package com.fintech.bookingpayments.service.audit;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * One compliance record: who touched which customer-related entity and how.
 */
@Value
public class AuditEntry {

    AuditAction action;
    String entityType;
    Long entityId;
    Long customerId;
    String actor;
    String detail;
    LocalDateTime occurredAt;
}
