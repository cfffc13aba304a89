package com.fintech.bankrec.service;

import com.fintech.bankrec.config.ReconciliationConfig;
import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.dto.ReconciliationStats;
import com.fintech.bankrec.dto.RunRequest;
import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import com.fintech.bankrec.repository.AuditEntryRepository;
import com.fintech.bankrec.repository.BankingTransactionRepository;
import com.fintech.bankrec.repository.ReceiptRepository;
import com.fintech.bankrec.repository.SplitGroupRepository;
import com.fintech.bankrec.service.audit.AuditLogService;
import com.fintech.bankrec.service.audit.AuditSnapshots;
import com.fintech.bankrec.service.matching.CandidateMatcher;
import com.fintech.bankrec.service.matching.MatchCandidate;
import com.fintech.bankrec.service.matching.MatchingTolerance;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for reconciliation runs and the maintenance operations around them.
 * <p>
 * Only one run may be in progress at a time. Each run gets its own
 * {@link ReconciliationOrchestrator} built from the configured defaults plus the
 * caller's overrides.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final ReconciliationConfig baseConfig;
    private final ReconciliationCollaborators collaborators;
    private final ReceiptRepository receiptRepository;
    private final BankingTransactionRepository transactionRepository;
    private final SplitGroupRepository splitGroupRepository;
    private final AuditEntryRepository auditEntryRepository;
    private final AuditLogService auditLogService;
    private final CandidateMatcher candidateMatcher;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter matchedCounter;
    private Counter splitGroupCounter;
    private Counter duplicatesRemovedCounter;
    private Counter reviewItemCounter;
    private Counter rolledBackCounter;
    private Timer reconciliationTimer;

    // Prevents concurrent reconciliation runs
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicReference<ReconciliationOrchestrator> currentRun = new AtomicReference<>();

    public ReconciliationService(ReconciliationConfig baseConfig,
                                 ReconciliationCollaborators collaborators,
                                 AuditEntryRepository auditEntryRepository,
                                 MeterRegistry meterRegistry) {
        this.baseConfig = baseConfig;
        this.collaborators = collaborators;
        this.receiptRepository = collaborators.getReceiptRepository();
        this.transactionRepository = collaborators.getTransactionRepository();
        this.splitGroupRepository = collaborators.getSplitGroupRepository();
        this.auditLogService = collaborators.getAuditLogService();
        this.candidateMatcher = collaborators.getCandidateMatcher();
        this.auditEntryRepository = auditEntryRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        matchedCounter = Counter.builder("reconciliation.receipts.matched")
                .description("Receipts linked one-to-one to a bank transaction")
                .register(meterRegistry);

        splitGroupCounter = Counter.builder("reconciliation.split.groups")
                .description("Split groups committed")
                .register(meterRegistry);

        duplicatesRemovedCounter = Counter.builder("reconciliation.duplicates.removed")
                .description("Duplicate receipts removed")
                .register(meterRegistry);

        reviewItemCounter = Counter.builder("reconciliation.review.items")
                .description("Records left for manual review")
                .register(meterRegistry);

        rolledBackCounter = Counter.builder("reconciliation.runs.rolledback")
                .description("Runs whose applying transaction rolled back")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete reconciliation run")
                .register(meterRegistry);
    }

    public ReconciliationRunSummary reconcile() {
        return reconcile(RunRequest.defaults());
    }

    /**
     * Runs one reconciliation batch.
     *
     * @throws com.fintech.bankrec.exception.ToleranceViolationException if an override is out of range
     * @throws ReconciliationException                                    if a run is already in progress
     */
    public ReconciliationRunSummary reconcile(RunRequest request) {
        // Validate overrides before taking the run slot.
        ReconciliationConfig config = configFor(request);

        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Reconciliation already in progress, refusing new run");
            throw new ReconciliationException(ReconciliationErrorType.RUN_IN_PROGRESS,
                    "Reconciliation already in progress");
        }

        try {
            ReconciliationOrchestrator orchestrator = new ReconciliationOrchestrator(config, collaborators);
            currentRun.set(orchestrator);
            log.info("Starting reconciliation run {}{}", orchestrator.getRunId(), config.isDryRun() ? " (dry run)" : "");

            ReconciliationRunSummary summary = reconciliationTimer.record(orchestrator::run);
            recordMetrics(summary);

            log.info("Reconciliation run {} finished {}. Matched: {}, Split groups: {}, Duplicates removed: {}, " +
                            "Shadow receipts: {}, Flagged for review: {}",
                    summary.getRunId(), summary.getFinalState(), summary.getMatched(), summary.getSplitGroups(),
                    summary.getDuplicatesRemoved(), summary.getShadowReceipts(), summary.getFlagged());
            return summary;
        } finally {
            currentRun.set(null);
            isRunning.set(false);
        }
    }

    /**
     * @return {@code true} if a run was in progress and had not started applying yet
     */
    public boolean cancelCurrentRun() {
        ReconciliationOrchestrator orchestrator = currentRun.get();
        if (orchestrator == null) {
            return false;
        }
        boolean accepted = orchestrator.cancel();
        log.info("Cancellation of run {} {}", orchestrator.getRunId(), accepted ? "requested" : "too late");
        return accepted;
    }

    ReconciliationConfig configFor(RunRequest request) {
        ReconciliationConfig.ReconciliationConfigBuilder builder = baseConfig.toBuilder();
        MatchingTolerance tolerance = baseConfig.getTolerance();
        if (request.getAmountToleranceCents() != null) {
            tolerance = tolerance.withAmountToleranceCents(request.getAmountToleranceCents());
        }
        if (request.getDateWindowDays() != null) {
            tolerance = tolerance.withDateWindowDays(request.getDateWindowDays());
        }
        builder.tolerance(tolerance);
        if (request.getDryRun() != null) {
            builder.dryRun(request.getDryRun());
        }
        if (request.getBackup() != null) {
            builder.backup(request.getBackup());
        }
        return builder.build();
    }

    private void recordMetrics(ReconciliationRunSummary summary) {
        reviewItemCounter.increment(summary.getFlagged());
        if (summary.isRolledBack()) {
            rolledBackCounter.increment();
            log.error("Reconciliation run {} rolled back at '{}'", summary.getRunId(), summary.getFailingItem());
            return;
        }
        if (summary.isDryRun()) {
            return;
        }
        matchedCounter.increment(summary.getMatched());
        splitGroupCounter.increment(summary.getSplitGroups());
        duplicatesRemovedCounter.increment(summary.getDuplicatesRemoved());
    }

    /**
     * Clears a receipt's direct link so it can be matched again. Split group members
     * are unlinked as a group, not individually.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Receipt unlinkReceipt(Long receiptId, String reason) {
        Receipt receipt = receiptRepository.findByIdForUpdate(receiptId)
                .orElseThrow(() -> new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                        "Receipt #" + receiptId + " does not exist"));
        if (receipt.getSplitGroupId() != null) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Receipt #" + receiptId + " belongs to split group #" + receipt.getSplitGroupId());
        }
        if (!receipt.isMatched()) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Receipt #" + receiptId + " is not linked");
        }

        String auditReason = "unlink: " + (reason == null || reason.isBlank() ? "manual re-match" : reason);
        Long transactionId = receipt.getBankingTransactionId();
        Optional<BankingTransaction> linked = transactionRepository.findByIdForUpdate(transactionId);

        Map<String, Object> before = AuditSnapshots.of(receipt);
        receipt.setBankingTransactionId(null);
        Receipt saved = receiptRepository.save(receipt);
        auditLogService.record(AuditActionType.UPDATE, AuditLogService.RECEIPTS, receiptId,
                before, AuditSnapshots.of(saved), auditReason, null);

        linked.filter(t -> receiptId.equals(t.getMatchedReceiptId())).ifPresent(transaction -> {
            Map<String, Object> transactionBefore = AuditSnapshots.of(transaction);
            transaction.setMatchedReceiptId(null);
            transactionRepository.save(transaction);
            auditLogService.record(AuditActionType.UPDATE, AuditLogService.BANKING_TRANSACTIONS, transactionId,
                    transactionBefore, AuditSnapshots.of(transaction), auditReason, null);
        });

        log.info("Unlinked receipt {} from transaction {}", receiptId, transactionId);
        return saved;
    }

    /**
     * Candidates for a receipt including already-linked transactions, for manual re-matching.
     */
    @Transactional(readOnly = true)
    public List<MatchCandidate> rematchCandidates(Long receiptId, Long amountToleranceCents, Integer dateWindowDays) {
        MatchingTolerance tolerance = configFor(RunRequest.builder()
                .amountToleranceCents(amountToleranceCents)
                .dateWindowDays(dateWindowDays)
                .build()).getTolerance();

        Receipt receipt = receiptRepository.findById(receiptId)
                .orElseThrow(() -> new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                        "Receipt #" + receiptId + " does not exist"));
        List<BankingTransaction> pool = transactionRepository.findByDateRange(
                receipt.getReceiptDate().minusDays(tolerance.getDateWindowDays()),
                receipt.getReceiptDate().plusDays(tolerance.getDateWindowDays()));
        return candidateMatcher.findCandidates(receipt, pool, tolerance, true);
    }

    @Transactional(readOnly = true)
    public Page<Receipt> unmatchedReceipts(int page, int size) {
        return receiptRepository.findUnmatched(PageRequest.of(page, Math.max(1, size)));
    }

    /**
     * Get current reconciliation statistics.
     * Useful for monitoring dashboards.
     */
    public ReconciliationStats getStats() {
        return ReconciliationStats.builder()
                .unmatchedReceipts(receiptRepository.countByBankingTransactionIdIsNullAndSplitGroupIdIsNull())
                .matchedReceipts(receiptRepository.countByBankingTransactionIdIsNotNull())
                .unmatchedTransactions(transactionRepository.countByMatchedReceiptIdIsNullAndMatchedSplitGroupIdIsNull())
                .splitGroups(splitGroupRepository.count())
                .auditEntries(auditEntryRepository.count())
                .isReconciliationRunning(isRunning.get())
                .build();
    }

    public boolean isRunning() {
        return isRunning.get();
    }
}
