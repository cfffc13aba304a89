package com.fintech.bankrec.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Append-only audit record. There are no setters and every column is
 * non-updatable; {@link com.fintech.bankrec.repository.AuditEntryRepository}
 * exposes no update or delete operations.
 */
@Entity
@Table(name = "audit_log", indexes = {
        @Index(name = "idx_audit_entity", columnList = "entity_table, entity_id"),
        @Index(name = "idx_audit_run", columnList = "run_id")
})
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id", updatable = false)
    private Long entryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 20)
    private AuditActionType actionType;

    @Column(name = "entity_table", nullable = false, updatable = false, length = 64)
    private String entityTable;

    @Column(name = "entity_id", nullable = false, updatable = false, length = 64)
    private String entityId;

    @Lob
    @Column(name = "before_snapshot", updatable = false)
    private String beforeSnapshot;

    @Lob
    @Column(name = "after_snapshot", updatable = false)
    private String afterSnapshot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false, updatable = false, length = 500)
    private String reason;

    @Column(name = "run_id", updatable = false, length = 64)
    private String runId;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = LocalDateTime.now();
        }
    }
}
