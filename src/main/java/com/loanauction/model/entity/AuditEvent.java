package com.loanauction.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEvent {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType; // auction.created, bid.accepted, bid.rejected, auction.closed

    @Column(name = "entity_type", nullable = false, length = 50)
    private String entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false, length = 50)
    private String action;

    @Column(length = 4000)
    private String details;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) eventId = UUID.randomUUID();
        if (timestamp == null) timestamp = Instant.now();
    }
}
