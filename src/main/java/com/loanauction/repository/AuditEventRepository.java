package com.loanauction.repository;

import com.loanauction.model.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByEntityIdOrderByTimestampAsc(String entityId);

    List<AuditEvent> findByEventType(String eventType);
}
