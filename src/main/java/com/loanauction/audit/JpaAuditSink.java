package com.loanauction.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanauction.model.entity.AuditEvent;
import com.loanauction.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Stores audit records in the {@code audit_events} table, details as JSON.
 */
@Component
public class JpaAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditSink.class);

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public JpaAuditSink(AuditEventRepository auditEventRepository, ObjectMapper objectMapper) {
        this.auditEventRepository = auditEventRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditRecord record) {
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .eventType(record.eventType())
                .entityType(record.entityType())
                .entityId(record.entityId())
                .userId(record.userId())
                .action(record.action())
                .details(toJson(record))
                .timestamp(record.timestamp())
                .build();
        auditEventRepository.save(event);
    }

    private String toJson(AuditRecord record) {
        try {
            return objectMapper.writeValueAsString(record.details());
        } catch (JsonProcessingException e) {
            log.warn("Audit details for {} {} not serializable, storing as text",
                    record.eventType(), record.entityId(), e);
            return String.valueOf(record.details());
        }
    }
}
