package com.fintech.bankrec.service;

import com.fintech.bankrec.config.ReconciliationConfig;
import com.fintech.bankrec.dto.LinkNotification;
import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.dto.ReviewItem;
import com.fintech.bankrec.dto.ReviewReason;
import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.PaymentMethod;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.entity.SplitGroup;
import com.fintech.bankrec.entity.SplitMemberType;
import com.fintech.bankrec.exception.TransactionRollbackException;
import com.fintech.bankrec.repository.BankingTransactionRepository;
import com.fintech.bankrec.repository.ReceiptRepository;
import com.fintech.bankrec.repository.SplitGroupRepository;
import com.fintech.bankrec.service.audit.AuditLogService;
import com.fintech.bankrec.service.audit.AuditSnapshots;
import com.fintech.bankrec.service.duplicate.DuplicateAssessment;
import com.fintech.bankrec.service.duplicate.DuplicateClassifier;
import com.fintech.bankrec.service.matching.CandidateMatcher;
import com.fintech.bankrec.service.matching.MatchCandidate;
import com.fintech.bankrec.service.matching.VendorSimilarity;
import com.fintech.bankrec.service.split.SplitCandidate;
import com.fintech.bankrec.service.split.SplitGroupResolver;
import com.fintech.bankrec.service.split.SplitResolution;
import com.fintech.bankrec.value.CalendarDates;
import com.fintech.bankrec.value.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives one reconciliation run through its states.
 * <p>
 * Planning (loading, matching, split resolution, duplicate classification) only reads.
 * Every accepted decision is then applied in a single transaction: either the whole
 * plan commits or nothing does. An instance runs once; create a new one per run.
 */
@Slf4j
public class ReconciliationOrchestrator {

    static final String RULE_SPLIT = "split-sum";
    static final String RULE_SHADOW = "shadow-receipt";

    private static final double SPLIT_CONFIDENCE_WITH_VENDOR = 0.95;
    private static final double SPLIT_CONFIDENCE = 0.80;

    private final ReconciliationConfig config;
    private final ReceiptRepository receiptRepository;
    private final BankingTransactionRepository transactionRepository;
    private final SplitGroupRepository splitGroupRepository;
    private final CandidateMatcher matcher;
    private final SplitGroupResolver splitResolver;
    private final DuplicateClassifier duplicateClassifier;
    private final AuditLogService auditLog;
    private final BackupService backupService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate applyTransaction;

    private final String runId = UUID.randomUUID().toString();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile RunState state = RunState.IDLE;

    public ReconciliationOrchestrator(ReconciliationConfig config, ReconciliationCollaborators collaborators) {
        this.config = config;
        this.receiptRepository = collaborators.getReceiptRepository();
        this.transactionRepository = collaborators.getTransactionRepository();
        this.splitGroupRepository = collaborators.getSplitGroupRepository();
        this.matcher = collaborators.getCandidateMatcher();
        this.splitResolver = collaborators.getSplitGroupResolver();
        this.auditLog = collaborators.getAuditLogService();
        this.backupService = collaborators.getBackupService();
        this.eventPublisher = collaborators.getEventPublisher();
        this.duplicateClassifier = new DuplicateClassifier(config);

        this.applyTransaction = new TransactionTemplate(collaborators.getTransactionManager());
        this.applyTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    public String getRunId() {
        return runId;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Requests cancellation. Honoured only before applying starts; once applying has
     * begun the run commits or rolls back as a whole.
     */
    public boolean cancel() {
        cancelRequested.set(true);
        return !state.isTerminal() && state != RunState.APPLYING;
    }

    public ReconciliationRunSummary run() {
        if (state != RunState.IDLE) {
            throw new IllegalStateException("Run " + runId + " has already started");
        }

        ReconciliationRunSummary summary = ReconciliationRunSummary.builder()
                .runId(runId)
                .dryRun(config.isDryRun())
                .startedAt(LocalDateTime.now())
                .build();

        transition(RunState.LOADING_UNMATCHED);
        PageRequest page = PageRequest.of(0, config.effectiveBatchSize());
        List<Receipt> receipts = receiptRepository.findUnmatched(page).getContent();
        List<BankingTransaction> transactions = transactionRepository.findUnmatched(page).getContent();
        summary.setReceiptsLoaded(receipts.size());
        summary.setTransactionsLoaded(transactions.size());
        log.info("Run {} loaded {} unmatched receipt(s) and {} unmatched transaction(s)",
                runId, receipts.size(), transactions.size());
        if (abortIfCancelled(summary)) {
            return summary;
        }

        Planning planning = new Planning(receipts, transactions);

        transition(RunState.MATCHING);
        planning.match();
        if (abortIfCancelled(summary)) {
            return summary;
        }

        transition(RunState.RESOLVING_SPLITS);
        planning.resolveReceiptSplits();
        planning.resolveTransactionSplits();
        if (abortIfCancelled(summary)) {
            return summary;
        }

        transition(RunState.CLASSIFYING_DUPLICATES);
        planning.classifyDuplicates();
        planning.collectLeftovers();

        ReconciliationPlan plan = planning.plan;
        summary.setReviewItems(plan.getReviewItems());

        if (config.isDryRun()) {
            summary.setMatched(plan.getLinks().size());
            summary.setSplitGroups(plan.getSplits().size());
            summary.setDuplicatesRemoved(plan.getDeletions().size());
            summary.setShadowReceipts(plan.getShadowTransactionIds().size());
            return finish(summary, RunState.PREVIEWED);
        }
        if (abortIfCancelled(summary)) {
            return summary;
        }

        if (config.isBackup()) {
            summary.setBackupTables(backupService.snapshot());
        }

        transition(RunState.APPLYING);
        try {
            applyTransaction.executeWithoutResult(status -> apply(plan, summary));
        } catch (TransactionRollbackException e) {
            return rolledBack(summary, e);
        } catch (RuntimeException e) {
            return rolledBack(summary, new TransactionRollbackException("commit of run " + runId, e));
        }
        return finish(summary, RunState.COMMITTED);
    }

    // Applying

    private void apply(ReconciliationPlan plan, ReconciliationRunSummary summary) {
        for (ReconciliationPlan.Link link : plan.getLinks()) {
            applyStep(link.describe(), () -> applyLink(link, summary));
        }
        for (ReconciliationPlan.Split split : plan.getSplits()) {
            applyStep(split.describe(), () -> applySplit(split, summary));
        }
        for (DuplicateAssessment deletion : plan.getDeletions()) {
            applyStep("delete duplicate receipt #" + deletion.getDeleteCandidateId(),
                    () -> applyDeletion(deletion, summary));
        }
        for (Long transactionId : plan.getShadowTransactionIds()) {
            applyStep("shadow receipt for transaction #" + transactionId,
                    () -> applyShadowReceipt(transactionId, summary));
        }
        for (ReviewItem item : plan.getReviewItems()) {
            applyStep("review entry for " + item.getEntityTable() + " #" + item.getEntityId(),
                    () -> auditLog.record(AuditActionType.REVIEW, item.getEntityTable(), item.getEntityId(),
                            null, item, item.getReason() + ": " + item.getDetail(), runId));
        }
    }

    private void applyStep(String item, Runnable step) {
        try {
            step.run();
        } catch (TransactionRollbackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransactionRollbackException(item, e);
        }
    }

    private void applyLink(ReconciliationPlan.Link link, ReconciliationRunSummary summary) {
        Receipt receipt = lockUnlinkedReceipt(link.getReceiptId());
        BankingTransaction transaction = lockUnlinkedTransaction(link.getTransactionId());

        Map<String, Object> receiptBefore = AuditSnapshots.of(receipt);
        Map<String, Object> transactionBefore = AuditSnapshots.of(transaction);
        receipt.setBankingTransactionId(transaction.getTransactionId());
        transaction.setMatchedReceiptId(receipt.getReceiptId());
        receiptRepository.saveAndFlush(receipt);
        transactionRepository.saveAndFlush(transaction);

        MatchCandidate candidate = link.getCandidate();
        String reason = String.format(Locale.ROOT, "auto-match %s confidence %.2f",
                candidate.getRuleApplied(), candidate.getConfidence());
        auditLog.record(AuditActionType.LINK, AuditLogService.RECEIPTS, receipt.getReceiptId(),
                receiptBefore, AuditSnapshots.of(receipt), reason, runId);
        auditLog.record(AuditActionType.LINK, AuditLogService.BANKING_TRANSACTIONS, transaction.getTransactionId(),
                transactionBefore, AuditSnapshots.of(transaction), reason, runId);

        notifyLink(summary, LinkNotification.builder()
                .receiptId(receipt.getReceiptId())
                .transactionId(transaction.getTransactionId())
                .confidence(candidate.getConfidence())
                .ruleApplied(candidate.getRuleApplied())
                .runId(runId)
                .build());
        summary.setMatched(summary.getMatched() + 1);
    }

    private void applySplit(ReconciliationPlan.Split split, ReconciliationRunSummary summary) {
        boolean receiptMembers = split.getMemberType() == SplitMemberType.RECEIPT;

        List<Money> memberAmounts = new ArrayList<>();
        List<Receipt> receiptGroup = new ArrayList<>();
        List<BankingTransaction> transactionGroup = new ArrayList<>();
        BankingTransaction anchorTransaction = null;
        Receipt anchorReceipt = null;
        Money anchorAmount;

        if (receiptMembers) {
            anchorTransaction = lockUnlinkedTransaction(split.getAnchorId());
            anchorAmount = anchorTransaction.signedAmount();
            for (Long id : split.getMemberIds()) {
                Receipt member = lockUnlinkedReceipt(id);
                receiptGroup.add(member);
                memberAmounts.add(member.amountAsMoney());
            }
        } else {
            anchorReceipt = lockUnlinkedReceipt(split.getAnchorId());
            anchorAmount = anchorReceipt.amountAsMoney();
            for (Long id : split.getMemberIds()) {
                BankingTransaction member = lockUnlinkedTransaction(id);
                transactionGroup.add(member);
                memberAmounts.add(member.signedAmount());
            }
        }

        Money total = Money.sum(memberAmounts);
        if (!total.isWithin(anchorAmount, Money.ONE_CENT) || !total.isWithin(split.getExpectedTotal(), Money.ONE_CENT)) {
            throw new IllegalStateException("Split members sum to " + total + ", expected " + split.getExpectedTotal());
        }

        SplitGroup group = splitGroupRepository.saveAndFlush(SplitGroup.builder()
                .memberType(split.getMemberType())
                .memberIds(new ArrayList<>(split.getMemberIds()))
                .anchorId(split.getAnchorId())
                .expectedTotal(split.getExpectedTotal().toBigDecimal())
                .runId(runId)
                .build());
        Long groupId = group.getSplitGroupId();
        String reason = String.format(Locale.ROOT, "%s of %d member(s) totalling %s",
                split.getRuleApplied(), split.getMemberIds().size(), split.getExpectedTotal());
        auditLog.record(AuditActionType.SPLIT_ASSIGN, AuditLogService.SPLIT_GROUPS, groupId,
                null, AuditSnapshots.of(group), reason, runId);

        if (receiptMembers) {
            for (Receipt member : receiptGroup) {
                Map<String, Object> before = AuditSnapshots.of(member);
                member.setSplitGroupId(groupId);
                member.setBankingTransactionId(anchorTransaction.getTransactionId());
                receiptRepository.saveAndFlush(member);
                auditLog.record(AuditActionType.SPLIT_ASSIGN, AuditLogService.RECEIPTS, member.getReceiptId(),
                        before, AuditSnapshots.of(member), reason, runId);
            }
            Map<String, Object> before = AuditSnapshots.of(anchorTransaction);
            anchorTransaction.setMatchedSplitGroupId(groupId);
            transactionRepository.saveAndFlush(anchorTransaction);
            auditLog.record(AuditActionType.LINK, AuditLogService.BANKING_TRANSACTIONS,
                    anchorTransaction.getTransactionId(), before, AuditSnapshots.of(anchorTransaction), reason, runId);
            notifyLink(summary, splitNotification(groupId, anchorTransaction.getTransactionId(), split));
        } else {
            Map<String, Object> receiptBefore = AuditSnapshots.of(anchorReceipt);
            anchorReceipt.setSplitGroupId(groupId);
            receiptRepository.saveAndFlush(anchorReceipt);
            auditLog.record(AuditActionType.SPLIT_ASSIGN, AuditLogService.RECEIPTS, anchorReceipt.getReceiptId(),
                    receiptBefore, AuditSnapshots.of(anchorReceipt), reason, runId);
            for (BankingTransaction member : transactionGroup) {
                Map<String, Object> before = AuditSnapshots.of(member);
                member.setMatchedSplitGroupId(groupId);
                transactionRepository.saveAndFlush(member);
                auditLog.record(AuditActionType.SPLIT_ASSIGN, AuditLogService.BANKING_TRANSACTIONS,
                        member.getTransactionId(), before, AuditSnapshots.of(member), reason, runId);
                notifyLink(summary, splitNotification(groupId, member.getTransactionId(), split));
            }
        }
        summary.setSplitGroups(summary.getSplitGroups() + 1);
    }

    private LinkNotification splitNotification(Long groupId, Long transactionId, ReconciliationPlan.Split split) {
        return LinkNotification.builder()
                .splitGroupId(groupId)
                .transactionId(transactionId)
                .confidence(split.getConfidence())
                .ruleApplied(split.getRuleApplied())
                .runId(runId)
                .build();
    }

    private void applyDeletion(DuplicateAssessment deletion, ReconciliationRunSummary summary) {
        Receipt duplicate = lockUnlinkedReceipt(deletion.getDeleteCandidateId());
        if (!receiptRepository.existsById(deletion.getKeepId())) {
            throw new IllegalStateException("Kept receipt #" + deletion.getKeepId() + " no longer exists");
        }
        Map<String, Object> before = AuditSnapshots.of(duplicate);
        receiptRepository.delete(duplicate);
        receiptRepository.flush();
        auditLog.record(AuditActionType.DELETE, AuditLogService.RECEIPTS, deletion.getDeleteCandidateId(),
                before, null, deletion.getReason(), runId);
        summary.setDuplicatesRemoved(summary.getDuplicatesRemoved() + 1);
    }

    private void applyShadowReceipt(Long transactionId, ReconciliationRunSummary summary) {
        BankingTransaction transaction = lockUnlinkedTransaction(transactionId);
        String statementText = transaction.getDescription() == null ? "" : transaction.getDescription().trim();

        Receipt shadow = receiptRepository.saveAndFlush(Receipt.builder()
                .vendorNameRaw(truncate(statementText.isEmpty() ? "BANKING TRANSACTION" : statementText, 200))
                .amount(transaction.signedAmount().toBigDecimal())
                .receiptDate(transaction.getTransactionDate())
                .description(truncate("Auto-created from banking transaction #" + transactionId
                        + (statementText.isEmpty() ? "" : ": " + statementText), 500))
                .paymentMethod(PaymentMethod.BANK_TRANSFER)
                .createdFromBanking(true)
                .bankingTransactionId(transactionId)
                .build());

        Map<String, Object> before = AuditSnapshots.of(transaction);
        transaction.setMatchedReceiptId(shadow.getReceiptId());
        transactionRepository.saveAndFlush(transaction);

        String reason = "shadow receipt for unmatched banking transaction #" + transactionId;
        auditLog.record(AuditActionType.INSERT, AuditLogService.RECEIPTS, shadow.getReceiptId(),
                null, AuditSnapshots.of(shadow), reason, runId);
        auditLog.record(AuditActionType.LINK, AuditLogService.BANKING_TRANSACTIONS, transactionId,
                before, AuditSnapshots.of(transaction), reason, runId);

        notifyLink(summary, LinkNotification.builder()
                .receiptId(shadow.getReceiptId())
                .transactionId(transactionId)
                .confidence(1.0)
                .ruleApplied(RULE_SHADOW)
                .runId(runId)
                .build());
        summary.setShadowReceipts(summary.getShadowReceipts() + 1);
    }

    private Receipt lockUnlinkedReceipt(Long receiptId) {
        Receipt receipt = receiptRepository.findByIdForUpdate(receiptId)
                .orElseThrow(() -> new IllegalStateException("Receipt #" + receiptId + " no longer exists"));
        if (receipt.isMatched() || receipt.getSplitGroupId() != null) {
            throw new IllegalStateException("Receipt #" + receiptId + " was linked by another run");
        }
        return receipt;
    }

    private BankingTransaction lockUnlinkedTransaction(Long transactionId) {
        BankingTransaction transaction = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new IllegalStateException("Transaction #" + transactionId + " no longer exists"));
        if (transaction.isLinked()) {
            throw new IllegalStateException("Transaction #" + transactionId + " was linked by another run");
        }
        return transaction;
    }

    private void notifyLink(ReconciliationRunSummary summary, LinkNotification notification) {
        summary.getLinks().add(notification);
        eventPublisher.publishEvent(notification);
    }

    // State handling

    private void transition(RunState next) {
        log.debug("Run {}: {} -> {}", runId, state, next);
        state = next;
    }

    private boolean abortIfCancelled(ReconciliationRunSummary summary) {
        if (!cancelRequested.get()) {
            return false;
        }
        log.info("Run {} cancelled during {}", runId, state);
        finish(summary, RunState.ABORTED);
        return true;
    }

    private ReconciliationRunSummary rolledBack(ReconciliationRunSummary summary, TransactionRollbackException e) {
        log.error("Run {} rolled back while applying {}: {}", runId, e.getFailingItem(), e.getMessage(), e);
        summary.setFailingItem(e.getFailingItem());
        summary.setErrorMessage(e.getMessage());
        summary.setMatched(0);
        summary.setSplitGroups(0);
        summary.setDuplicatesRemoved(0);
        summary.setShadowReceipts(0);
        summary.getLinks().clear();
        return finish(summary, RunState.ROLLED_BACK);
    }

    private ReconciliationRunSummary finish(ReconciliationRunSummary summary, RunState terminal) {
        transition(terminal);
        summary.setFinalState(terminal);
        summary.setCompletedAt(LocalDateTime.now());
        return summary;
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * Read-only planning over one batch of unmatched records.
     */
    private final class Planning {

        private final ReconciliationPlan plan = new ReconciliationPlan();
        private final List<Receipt> receipts;
        private final List<BankingTransaction> transactions;

        private final Map<Long, List<MatchCandidate>> candidatesByReceipt = new HashMap<>();
        private final Set<Long> claimedTransactions = new HashSet<>();
        /**
         * Receipt id to the transaction it will be linked to, directly or through a split.
         */
        private final Map<Long, Long> plannedTransactionByReceipt = new HashMap<>();
        private final Map<Long, List<MatchCandidate>> ambiguous = new HashMap<>();
        private final Set<Long> contested = new HashSet<>();
        private final Set<Long> belowMinConfidence = new HashSet<>();
        private final Set<Long> splitAttempted = new HashSet<>();
        private final Set<Long> deletions = new HashSet<>();
        private final Set<Long> flagged = new HashSet<>();

        Planning(List<Receipt> receipts, List<BankingTransaction> transactions) {
            this.receipts = receipts;
            this.transactions = transactions;
        }

        void match() {
            Map<Long, Double> bestConfidence = new HashMap<>();
            for (Receipt receipt : receipts) {
                List<MatchCandidate> all = matcher.findCandidates(receipt, transactions, config.getTolerance());
                List<MatchCandidate> kept = all.stream()
                        .filter(c -> c.getConfidence() >= config.getMinConfidence())
                        .collect(Collectors.toList());
                if (!all.isEmpty() && kept.isEmpty()) {
                    belowMinConfidence.add(receipt.getReceiptId());
                }
                candidatesByReceipt.put(receipt.getReceiptId(), kept);
                bestConfidence.put(receipt.getReceiptId(), kept.isEmpty() ? 0.0 : kept.get(0).getConfidence());
            }

            // Strongest evidence claims its transaction first.
            List<Receipt> order = new ArrayList<>(receipts);
            order.sort(Comparator.<Receipt>comparingDouble(r -> bestConfidence.get(r.getReceiptId())).reversed()
                    .thenComparing(Receipt::getReceiptDate)
                    .thenComparing(Receipt::getReceiptId));

            for (Receipt receipt : order) {
                List<MatchCandidate> candidates = candidatesByReceipt.get(receipt.getReceiptId());
                List<MatchCandidate> open = candidates.stream()
                        .filter(c -> !claimedTransactions.contains(c.getTransactionId()))
                        .collect(Collectors.toList());
                if (open.isEmpty()) {
                    if (!candidates.isEmpty()) {
                        contested.add(receipt.getReceiptId());
                    }
                    continue;
                }
                MatchCandidate top = open.get(0);
                if (open.size() > 1 && top.tiesWith(open.get(1))) {
                    log.warn("Receipt {} has {} equally ranked candidates, leaving for review",
                            receipt.getReceiptId(), open.stream().filter(top::tiesWith).count());
                    ambiguous.put(receipt.getReceiptId(), open);
                    continue;
                }
                plan.getLinks().add(new ReconciliationPlan.Link(receipt.getReceiptId(), top.getTransactionId(), top));
                claimedTransactions.add(top.getTransactionId());
                plannedTransactionByReceipt.put(receipt.getReceiptId(), top.getTransactionId());
            }
            log.debug("Run {} planned {} direct link(s), {} ambiguous", runId, plan.getLinks().size(), ambiguous.size());
        }

        /**
         * Several same-vendor receipts paying one bank line.
         */
        void resolveReceiptSplits() {
            for (BankingTransaction transaction : transactions) {
                if (claimedTransactions.contains(transaction.getTransactionId())) {
                    continue;
                }
                Money target = transaction.signedAmount();
                if (target.isZero()) {
                    continue;
                }

                Map<String, List<Receipt>> byVendor = new LinkedHashMap<>();
                for (Receipt receipt : openReceipts()) {
                    if (!splitMemberFits(receipt.amountAsMoney(), receipt.getReceiptDate(), target,
                            transaction.getTransactionDate())) {
                        continue;
                    }
                    String vendorKey = VendorSimilarity.vendorKey(receipt.effectiveVendor());
                    if (!vendorKey.isEmpty()) {
                        byVendor.computeIfAbsent(vendorKey, k -> new ArrayList<>()).add(receipt);
                    }
                }

                // Vendors named on the statement line are tried first.
                List<String> vendorOrder = new ArrayList<>(byVendor.keySet());
                vendorOrder.sort(Comparator.<String>comparingDouble(
                        v -> VendorSimilarity.score(v, transaction.getDescription())).reversed()
                        .thenComparing(Comparator.naturalOrder()));

                for (String vendorKey : vendorOrder) {
                    List<Receipt> siblings = byVendor.get(vendorKey);
                    if (siblings.size() < 2) {
                        continue;
                    }
                    siblings.forEach(r -> splitAttempted.add(r.getReceiptId()));
                    SplitResolution resolution = splitResolver.resolveSplit(target,
                            siblings.stream().map(SplitCandidate::fromReceipt).collect(Collectors.toList()),
                            config.effectiveMaxSplitMembers(), config.getMaxSplitCandidates());
                    if (!resolution.isResolved()) {
                        continue;
                    }
                    double confidence = VendorSimilarity.matches(vendorKey, transaction.getDescription())
                            ? SPLIT_CONFIDENCE_WITH_VENDOR : SPLIT_CONFIDENCE;
                    if (confidence < config.getMinConfidence()) {
                        continue;
                    }
                    plan.getSplits().add(new ReconciliationPlan.Split(SplitMemberType.RECEIPT,
                            transaction.getTransactionId(), resolution.memberIds(), target, confidence, RULE_SPLIT));
                    claimedTransactions.add(transaction.getTransactionId());
                    for (Long memberId : resolution.memberIds()) {
                        plannedTransactionByReceipt.put(memberId, transaction.getTransactionId());
                    }
                    break;
                }
            }
        }

        /**
         * One receipt paid by several bank lines.
         */
        void resolveTransactionSplits() {
            for (Receipt receipt : openReceipts()) {
                Money target = receipt.amountAsMoney();
                String vendor = receipt.effectiveVendor();
                if (target.isZero() || vendor == null || vendor.isBlank()) {
                    continue;
                }
                List<SplitCandidate> pool = transactions.stream()
                        .filter(t -> !claimedTransactions.contains(t.getTransactionId()))
                        .filter(t -> splitMemberFits(t.signedAmount(), t.getTransactionDate(), target,
                                receipt.getReceiptDate()))
                        .filter(t -> VendorSimilarity.matches(vendor, t.getDescription()))
                        .map(SplitCandidate::fromTransaction)
                        .collect(Collectors.toList());
                if (pool.size() < 2) {
                    continue;
                }
                splitAttempted.add(receipt.getReceiptId());
                SplitResolution resolution = splitResolver.resolveSplit(target, pool,
                        config.effectiveMaxSplitMembers(), config.getMaxSplitCandidates());
                if (!resolution.isResolved()) {
                    continue;
                }
                plan.getSplits().add(new ReconciliationPlan.Split(SplitMemberType.BANKING_TRANSACTION,
                        receipt.getReceiptId(), resolution.memberIds(), target, SPLIT_CONFIDENCE_WITH_VENDOR,
                        RULE_SPLIT));
                claimedTransactions.addAll(resolution.memberIds());
                plannedTransactionByReceipt.put(receipt.getReceiptId(), resolution.memberIds().get(0));
            }
        }

        private boolean splitMemberFits(Money memberAmount, LocalDate memberDate,
                                        Money anchorAmount, LocalDate anchorDate) {
            return memberAmount.signum() == anchorAmount.signum()
                    && memberAmount.abs().isLessThan(anchorAmount.abs())
                    && memberDate != null && anchorDate != null
                    && CalendarDates.withinWindow(memberDate, anchorDate, config.getSplitDateWindowDays());
        }

        private List<Receipt> openReceipts() {
            return receipts.stream()
                    .filter(r -> !plannedTransactionByReceipt.containsKey(r.getReceiptId()))
                    .filter(r -> !ambiguous.containsKey(r.getReceiptId()))
                    .filter(r -> r.getAmount() != null && r.getReceiptDate() != null)
                    .collect(Collectors.toList());
        }

        void classifyDuplicates() {
            Map<String, List<Receipt>> historyByVendor = new HashMap<>();
            List<Receipt> ordered = receipts.stream()
                    .filter(r -> !plannedTransactionByReceipt.containsKey(r.getReceiptId()))
                    .sorted(Comparator.comparing(Receipt::getReceiptId))
                    .collect(Collectors.toList());

            for (Receipt receipt : ordered) {
                if (deletions.contains(receipt.getReceiptId()) || receipt.getAmount() == null) {
                    continue;
                }
                String vendorKey = VendorSimilarity.vendorKey(receipt.effectiveVendor());
                if (vendorKey.isEmpty()) {
                    continue;
                }
                List<Receipt> peers = receiptRepository.findDuplicatePeers(receipt.getAmount(), vendorKey,
                        receipt.getReceiptId());
                if (peers.isEmpty()) {
                    continue;
                }
                List<Receipt> history = historyByVendor.computeIfAbsent(vendorKey, receiptRepository::findByVendorKey);

                for (Receipt peer : peers) {
                    if (deletions.contains(peer.getReceiptId())) {
                        continue;
                    }
                    DuplicateAssessment assessment = duplicateClassifier.classify(asPlanned(receipt), asPlanned(peer),
                            history);
                    switch (assessment.getVerdict()) {
                        case TRUE_DUPLICATE:
                            acceptDuplicate(assessment, receipt, peer);
                            break;
                        case PROTECTED_FEE:
                            flag(receipt, ReviewReason.PROTECTED_FEE,
                                    "same-day repeat of unreversed fee, also receipt #" + peer.getReceiptId());
                            break;
                        default:
                            log.debug("Receipts {} and {}: {} ({})", receipt.getReceiptId(), peer.getReceiptId(),
                                    assessment.getVerdict(), assessment.getReason());
                            break;
                    }
                    if (deletions.contains(receipt.getReceiptId())) {
                        break;
                    }
                }
            }
        }

        private void acceptDuplicate(DuplicateAssessment assessment, Receipt receipt, Receipt peer) {
            Long deleteId = assessment.getDeleteCandidateId();
            if (deletions.contains(assessment.getKeepId())) {
                return;
            }
            Receipt doomed = deleteId.equals(receipt.getReceiptId()) ? receipt : peer;
            if (doomed.isMatched() || doomed.getSplitGroupId() != null
                    || plannedTransactionByReceipt.containsKey(deleteId)) {
                return;
            }
            if (config.isRemoveDuplicates()) {
                plan.getDeletions().add(assessment);
                deletions.add(deleteId);
                log.info("Receipt {} is a duplicate of receipt {}, scheduled for removal",
                        deleteId, assessment.getKeepId());
            } else {
                flag(doomed, ReviewReason.DUPLICATE_RETAINED,
                        "duplicate of receipt #" + assessment.getKeepId() + ", removal disabled");
            }
        }

        /**
         * The receipt as it will look once this run's links are applied.
         */
        private Receipt asPlanned(Receipt receipt) {
            Long plannedTransaction = plannedTransactionByReceipt.get(receipt.getReceiptId());
            if (plannedTransaction == null || receipt.isMatched()) {
                return receipt;
            }
            return receipt.toBuilder().bankingTransactionId(plannedTransaction).build();
        }

        void collectLeftovers() {
            Set<Long> transactionsUnderReview = new HashSet<>();

            for (Receipt receipt : receipts) {
                Long id = receipt.getReceiptId();
                if (plannedTransactionByReceipt.containsKey(id) || deletions.contains(id)) {
                    continue;
                }
                if (ambiguous.containsKey(id)) {
                    List<MatchCandidate> tied = ambiguous.get(id);
                    tied.forEach(c -> transactionsUnderReview.add(c.getTransactionId()));
                    flag(receipt, ReviewReason.AMBIGUOUS_MATCH, tied.size() + " candidates share the top rank", tied);
                } else if (splitAttempted.contains(id)) {
                    flag(receipt, ReviewReason.SPLIT_NOT_FOUND,
                            "no combination of siblings sums to a counterpart within one cent");
                } else if (contested.contains(id)) {
                    flag(receipt, ReviewReason.CONTESTED_TRANSACTION,
                            "every candidate was claimed by a stronger match",
                            candidatesByReceipt.get(id));
                } else if (belowMinConfidence.contains(id)) {
                    flag(receipt, ReviewReason.BELOW_MIN_CONFIDENCE,
                            "candidates scored below " + config.getMinConfidence(),
                            matcher.findCandidates(receipt, transactions, config.getTolerance()));
                } else if (!flagged.contains(id)) {
                    flag(receipt, ReviewReason.NO_CANDIDATE, "no bank transaction within tolerance");
                }
            }

            for (BankingTransaction transaction : transactions) {
                Long id = transaction.getTransactionId();
                if (claimedTransactions.contains(id)) {
                    continue;
                }
                boolean debit = transaction.signedAmount().isPositive();
                if (config.isCreateShadowReceipts() && debit && !transactionsUnderReview.contains(id)) {
                    plan.getShadowTransactionIds().add(id);
                    continue;
                }
                ReviewReason reason = transactionsUnderReview.contains(id)
                        ? ReviewReason.AMBIGUOUS_MATCH : ReviewReason.NO_CANDIDATE;
                plan.getReviewItems().add(ReviewItem.builder()
                        .entityTable(AuditLogService.BANKING_TRANSACTIONS)
                        .entityId(id)
                        .reason(reason)
                        .detail(reason == ReviewReason.AMBIGUOUS_MATCH
                                ? "candidate of an ambiguous receipt" : "no receipt within tolerance")
                        .amount(transaction.signedAmount().toBigDecimal())
                        .date(transaction.getTransactionDate())
                        .vendor(transaction.getDescription())
                        .build());
            }
        }

        private void flag(Receipt receipt, ReviewReason reason, String detail) {
            flag(receipt, reason, detail, List.of());
        }

        private void flag(Receipt receipt, ReviewReason reason, String detail, List<MatchCandidate> candidates) {
            flagged.add(receipt.getReceiptId());
            boolean alreadyListed = plan.getReviewItems().stream()
                    .anyMatch(item -> AuditLogService.RECEIPTS.equals(item.getEntityTable())
                            && receipt.getReceiptId().equals(item.getEntityId())
                            && item.getReason() == reason);
            if (alreadyListed) {
                return;
            }
            plan.getReviewItems().add(ReviewItem.builder()
                    .entityTable(AuditLogService.RECEIPTS)
                    .entityId(receipt.getReceiptId())
                    .reason(reason)
                    .detail(detail)
                    .amount(receipt.getAmount())
                    .date(receipt.getReceiptDate())
                    .vendor(receipt.effectiveVendor())
                    .candidates(candidates.stream().map(c -> ReviewItem.CandidateSummary.builder()
                            .transactionId(c.getTransactionId())
                            .confidence(c.getConfidence())
                            .ruleApplied(c.getRuleApplied())
                            .amountDelta(c.getAmountDelta())
                            .dateDeltaDays(c.getDateDeltaDays())
                            .build()).collect(Collectors.toList()))
                    .build());
        }
    }
}
