package com.fintech.bookingpayments.service.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit entries to the {@code AUDIT} logger, which deployments route to their audit store.
 */
@Component
public class LoggingAuditLog implements AuditLog {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    @Override
    public void record(AuditEntry entry) {
        AUDIT.info("action={} entity={}#{} customer={} actor={} at={} detail={}",
                entry.getAction(), entry.getEntityType(), entry.getEntityId(), entry.getCustomerId(),
                entry.getActor(), entry.getOccurredAt(), entry.getDetail());
    }
}
