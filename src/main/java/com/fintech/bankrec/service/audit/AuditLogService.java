package com.fintech.bankrec.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.AuditEntry;
import com.fintech.bankrec.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes the append-only audit trail.
 * <p>
 * {@link #record} must run inside the caller's transaction so that an audit entry
 * commits or rolls back together with the mutation it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    public static final String RECEIPTS = "receipts";
    public static final String BANKING_TRANSACTIONS = "banking_transactions";
    public static final String SPLIT_GROUPS = "split_groups";

    private final AuditEntryRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * @param before snapshot prior to the change, {@code null} for inserts
     * @param after  snapshot after the change, {@code null} for deletes
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(AuditActionType actionType, String entityTable, Object entityId,
                             Object before, Object after, String reason, String runId) {
        AuditEntry entry = AuditEntry.builder()
                .actionType(actionType)
                .entityTable(entityTable)
                .entityId(String.valueOf(entityId))
                .beforeSnapshot(serialize(before))
                .afterSnapshot(serialize(after))
                .reason(reason)
                .runId(runId)
                .build();

        AuditEntry saved = repository.save(entry);
        log.debug("Audit {} {}#{}: {}", actionType, entityTable, entityId, reason);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> historyOf(String entityTable, Object entityId) {
        return repository.findByEntityTableAndEntityIdOrderByEntryIdAsc(entityTable, String.valueOf(entityId));
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> entriesForRun(String runId) {
        return repository.findByRunIdOrderByEntryIdAsc(runId);
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> latest(int limit) {
        return repository.findAllByOrderByEntryIdDesc(PageRequest.of(0, Math.max(1, limit))).getContent();
    }

    private String serialize(Object snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit snapshot", e);
        }
    }
}
