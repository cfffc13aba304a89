package com.fintech.bankrec.service;

import com.fintech.bankrec.repository.BankingTransactionRepository;
import com.fintech.bankrec.repository.ReceiptRepository;
import com.fintech.bankrec.repository.SplitGroupRepository;
import com.fintech.bankrec.service.audit.AuditLogService;
import com.fintech.bankrec.service.matching.CandidateMatcher;
import com.fintech.bankrec.service.split.SplitGroupResolver;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * The stateless beans a {@link ReconciliationOrchestrator} works with. Run settings are
 * not here; they travel separately in the orchestrator's config.
 */
@Component
@Getter
@RequiredArgsConstructor
public class ReconciliationCollaborators {

    private final ReceiptRepository receiptRepository;
    private final BankingTransactionRepository transactionRepository;
    private final SplitGroupRepository splitGroupRepository;
    private final CandidateMatcher candidateMatcher;
    private final SplitGroupResolver splitGroupResolver;
    private final AuditLogService auditLogService;
    private final BackupService backupService;
    private final PlatformTransactionManager transactionManager;
    private final ApplicationEventPublisher eventPublisher;
}
