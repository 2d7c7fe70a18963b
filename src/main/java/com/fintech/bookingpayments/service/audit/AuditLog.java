package com.fintech.bookingpayments.service.audit;

/**
 * Sink for audit entries. Storage is owned elsewhere; implementations may throw,
 * callers go through {@link AuditTrail} which never lets a failure escape.
 */
public interface AuditLog {

    void record(AuditEntry entry);
}
