package com.fintech.bankrec.repository;

import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.AuditEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to the audit log: save and queries, no update or delete.
 */
public interface AuditEntryRepository extends Repository<AuditEntry, Long> {

    AuditEntry save(AuditEntry entry);

    long count();

    List<AuditEntry> findByEntityTableAndEntityIdOrderByEntryIdAsc(String entityTable, String entityId);

    List<AuditEntry> findByRunIdOrderByEntryIdAsc(String runId);

    long countByActionType(AuditActionType actionType);

    Page<AuditEntry> findAllByOrderByEntryIdDesc(Pageable pageable);
}
