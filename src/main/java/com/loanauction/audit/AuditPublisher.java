package com.loanauction.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards audit records to the {@link AuditSink} off the request thread.
 * A failing sink is logged and never reaches the caller; the auction state
 * change it describes is already published.
 */
@Component
public class AuditPublisher {

    private static final Logger log = LoggerFactory.getLogger(AuditPublisher.class);

    private final AuditSink auditSink;

    public AuditPublisher(AuditSink auditSink) {
        this.auditSink = auditSink;
    }

    @Async("auditExecutor")
    public void publish(AuditRecord record) {
        try {
            auditSink.record(record);
        } catch (RuntimeException e) {
            log.warn("Audit record dropped: type={}, entity={}, user={}",
                    record.eventType(), record.entityId(), record.userId(), e);
        }
    }
}
