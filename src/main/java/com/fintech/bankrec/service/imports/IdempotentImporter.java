package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.repository.BankingTransactionRepository;
import com.fintech.bankrec.repository.ReceiptRepository;
import com.fintech.bankrec.service.audit.AuditLogService;
import com.fintech.bankrec.service.audit.AuditSnapshots;
import com.fintech.bankrec.service.matching.VendorSimilarity;
import com.fintech.bankrec.value.Money;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Inserts receipts and statement lines only when an equivalent record does not exist.
 * <p>
 * Each row is checked and inserted in its own read-committed transaction together with
 * its audit entry. The unique {@code import_key} constraint is the backstop for two
 * overlapping imports: a row that loses that race is reported as already imported.
 */
@Service
@Slf4j
public class IdempotentImporter {

    private final ReceiptRepository receiptRepository;
    private final BankingTransactionRepository transactionRepository;
    private final AuditLogService auditLogService;
    private final ImportSchemaProvider schemaProvider;
    private final VendorCanonicalizationClient vendorClient;
    private final TransactionTemplate rowTransaction;
    private final MeterRegistry meterRegistry;

    public IdempotentImporter(ReceiptRepository receiptRepository,
                              BankingTransactionRepository transactionRepository,
                              AuditLogService auditLogService,
                              ImportSchemaProvider schemaProvider,
                              VendorCanonicalizationClient vendorClient,
                              PlatformTransactionManager transactionManager,
                              MeterRegistry meterRegistry) {
        this.receiptRepository = receiptRepository;
        this.transactionRepository = transactionRepository;
        this.auditLogService = auditLogService;
        this.schemaProvider = schemaProvider;
        this.vendorClient = vendorClient;
        this.meterRegistry = meterRegistry;

        this.rowTransaction = new TransactionTemplate(transactionManager);
        this.rowTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.rowTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    /**
     * Imports a mixed batch, dispatching each row on its type.
     */
    public ImportReport importBatch(String batchId, List<? extends ImportRow> rows, boolean dryRun) {
        List<ReceiptImportRow> receipts = new ArrayList<>();
        List<TransactionImportRow> transactions = new ArrayList<>();
        for (ImportRow row : rows) {
            if (row instanceof ReceiptImportRow) {
                receipts.add((ReceiptImportRow) row);
            } else if (row instanceof TransactionImportRow) {
                transactions.add((TransactionImportRow) row);
            } else {
                throw new IllegalArgumentException("Unsupported import row " + row.getClass().getName());
            }
        }

        ImportReport report = newReport(batchId, dryRun);
        if (!receipts.isEmpty()) {
            importReceipts(batchId, receipts, dryRun, report);
        }
        if (!transactions.isEmpty()) {
            importTransactions(batchId, transactions, dryRun, report);
        }
        report.setCompletedAt(LocalDateTime.now());
        return report;
    }

    public ImportReport importReceipts(String batchId, List<ReceiptImportRow> rows, boolean dryRun) {
        ImportReport report = newReport(batchId, dryRun);
        importReceipts(batchId, rows, dryRun, report);
        report.setCompletedAt(LocalDateTime.now());
        logSummary("receipt", report);
        return report;
    }

    public ImportReport importTransactions(String batchId, List<TransactionImportRow> rows, boolean dryRun) {
        ImportReport report = newReport(batchId, dryRun);
        importTransactions(batchId, rows, dryRun, report);
        report.setCompletedAt(LocalDateTime.now());
        logSummary("statement", report);
        return report;
    }

    /**
     * Imports what a CSV file yielded; its unparseable lines are reported as failed rows.
     */
    public ImportReport importReceipts(String batchId, CsvReadResult<ReceiptImportRow> parsed, boolean dryRun) {
        ImportReport report = newReport(batchId, dryRun);
        addParseFailures(parsed, report);
        importReceipts(batchId, parsed.getRows(), dryRun, report);
        report.setCompletedAt(LocalDateTime.now());
        logSummary("receipt", report);
        return report;
    }

    public ImportReport importTransactions(String batchId, CsvReadResult<TransactionImportRow> parsed,
                                           boolean dryRun) {
        ImportReport report = newReport(batchId, dryRun);
        addParseFailures(parsed, report);
        importTransactions(batchId, parsed.getRows(), dryRun, report);
        report.setCompletedAt(LocalDateTime.now());
        logSummary("statement", report);
        return report;
    }

    private void addParseFailures(CsvReadResult<?> parsed, ImportReport report) {
        for (ImportFailure failure : parsed.getFailures()) {
            report.addFailure(failure.getRowIndex(), failure.getMessage());
            countRow(ImportOutcome.FAILED);
        }
    }

    private void importReceipts(String batchId, List<ReceiptImportRow> rows, boolean dryRun, ImportReport report) {
        ImportSchema schema = schemaProvider.currentSchema();
        Set<String> keysInBatch = new HashSet<>();

        for (ReceiptImportRow row : rows) {
            ImportOutcome outcome;
            try {
                validate(row);
                String vendorKey = VendorSimilarity.vendorKey(row.getVendor());
                String importKey = ImportKeys.receiptKey(row.getVendor(), row.getAmount(), row.getDate());

                if (dryRun) {
                    boolean exists = !keysInBatch.add(importKey)
                            || receiptRepository.existsByNaturalKey(vendorKey, Money.of(row.getAmount()).toBigDecimal(), row.getDate());
                    outcome = exists ? ImportOutcome.SKIPPED_DUPLICATE : ImportOutcome.INSERTED;
                } else {
                    Receipt receipt = toReceipt(row, importKey, schema);
                    String reason = provenance(batchId, row);
                    outcome = insertReceiptIfAbsent(receipt, vendorKey, reason, report);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Receipt row {} of batch {} rejected: {}", row.getRowIndex(), batchId, e.getMessage());
                report.addFailure(row.getRowIndex(), e.getMessage());
                countRow(ImportOutcome.FAILED);
                continue;
            } catch (RuntimeException e) {
                log.error("Receipt row {} of batch {} failed: {}", row.getRowIndex(), batchId, e.getMessage(), e);
                report.addFailure(row.getRowIndex(), e.getMessage());
                countRow(ImportOutcome.FAILED);
                continue;
            }
            report.record(outcome);
            countRow(outcome);
        }
    }

    private ImportOutcome insertReceiptIfAbsent(Receipt receipt, String vendorKey, String reason, ImportReport report) {
        try {
            Receipt saved = rowTransaction.execute(status -> {
                if (receiptRepository.existsByImportKey(receipt.getImportKey())
                        || receiptRepository.existsByNaturalKey(vendorKey, receipt.getAmount(), receipt.getReceiptDate())) {
                    return null;
                }
                Receipt inserted = receiptRepository.saveAndFlush(receipt);
                auditLogService.record(AuditActionType.INSERT, AuditLogService.RECEIPTS, inserted.getReceiptId(),
                        null, AuditSnapshots.of(inserted), reason, report.getBatchId());
                return inserted;
            });
            if (saved == null) {
                return ImportOutcome.SKIPPED_DUPLICATE;
            }
            report.getInsertedIds().add(saved.getReceiptId());
            return ImportOutcome.INSERTED;
        } catch (DataIntegrityViolationException e) {
            log.info("Receipt {} was inserted concurrently, treating as already imported", receipt.getImportKey());
            return ImportOutcome.SKIPPED_DUPLICATE;
        }
    }

    private void importTransactions(String batchId, List<TransactionImportRow> rows, boolean dryRun,
                                    ImportReport report) {
        Map<String, Integer> occurrences = new HashMap<>();

        for (TransactionImportRow row : rows) {
            ImportOutcome outcome;
            try {
                validate(row);
                String baseKey = ImportKeys.transactionBaseKey(row.getAccountId(), row.getDate(),
                        row.getDebit(), row.getCredit(), row.getDescription());
                int occurrence = occurrences.merge(baseKey, 1, Integer::sum);
                String importKey = ImportKeys.transactionKey(baseKey, occurrence);

                if (dryRun) {
                    outcome = transactionRepository.existsByImportKey(importKey)
                            ? ImportOutcome.SKIPPED_DUPLICATE : ImportOutcome.INSERTED;
                } else {
                    BankingTransaction transaction = toTransaction(row, importKey);
                    outcome = insertTransactionIfAbsent(transaction, provenance(batchId, row), report);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Statement row {} of batch {} rejected: {}", row.getRowIndex(), batchId, e.getMessage());
                report.addFailure(row.getRowIndex(), e.getMessage());
                countRow(ImportOutcome.FAILED);
                continue;
            } catch (RuntimeException e) {
                log.error("Statement row {} of batch {} failed: {}", row.getRowIndex(), batchId, e.getMessage(), e);
                report.addFailure(row.getRowIndex(), e.getMessage());
                countRow(ImportOutcome.FAILED);
                continue;
            }
            report.record(outcome);
            countRow(outcome);
        }
    }

    private ImportOutcome insertTransactionIfAbsent(BankingTransaction transaction, String reason,
                                                    ImportReport report) {
        try {
            BankingTransaction saved = rowTransaction.execute(status -> {
                if (transactionRepository.existsByImportKey(transaction.getImportKey())) {
                    return null;
                }
                BankingTransaction inserted = transactionRepository.saveAndFlush(transaction);
                auditLogService.record(AuditActionType.INSERT, AuditLogService.BANKING_TRANSACTIONS,
                        inserted.getTransactionId(), null, AuditSnapshots.of(inserted), reason, report.getBatchId());
                return inserted;
            });
            if (saved == null) {
                return ImportOutcome.SKIPPED_DUPLICATE;
            }
            report.getInsertedIds().add(saved.getTransactionId());
            return ImportOutcome.INSERTED;
        } catch (DataIntegrityViolationException e) {
            log.info("Statement line {} was inserted concurrently, treating as already imported",
                    transaction.getImportKey());
            return ImportOutcome.SKIPPED_DUPLICATE;
        }
    }

    private Receipt toReceipt(ReceiptImportRow row, String importKey, ImportSchema schema) {
        Receipt.ReceiptBuilder builder = Receipt.builder()
                .vendorNameRaw(row.getVendor().trim())
                .canonicalVendor(vendorClient.canonicalize(row.getVendor()).orElse(null))
                .amount(Money.of(row.getAmount()).toBigDecimal())
                .receiptDate(row.getDate())
                .description(row.getDescription())
                .glAccount(row.getGlAccount())
                .paymentMethod(row.getPaymentMethod())
                .sourceReference(row.sourceReference().orElse(null))
                .importKey(importKey);

        if (schema.supports(ImportSchema.VEHICLE_ID)) {
            builder.vehicleId(row.vehicleId().orElse(null));
        }
        if (schema.supports(ImportSchema.EMPLOYEE_ID)) {
            builder.employeeId(row.employeeId().orElse(null));
        }
        if (schema.supports(ImportSchema.RESERVE_NUMBER)) {
            builder.reserveNumber(row.reserveNumber().orElse(null));
        }
        return builder.build();
    }

    private static BankingTransaction toTransaction(TransactionImportRow row, String importKey) {
        return BankingTransaction.builder()
                .accountId(row.getAccountId().trim())
                .transactionDate(row.getDate())
                .debitAmount(Money.orZero(row.getDebit()).toBigDecimal())
                .creditAmount(Money.orZero(row.getCredit()).toBigDecimal())
                .description(row.getDescription())
                .importKey(importKey)
                .build();
    }

    private static void validate(ReceiptImportRow row) {
        if (row.getDate() == null) {
            throw new IllegalArgumentException("Missing date");
        }
        if (row.getVendor() == null || row.getVendor().isBlank()) {
            throw new IllegalArgumentException("Missing vendor");
        }
        if (row.getAmount() == null) {
            throw new IllegalArgumentException("Missing amount");
        }
        requireWholeCents("amount", row.getAmount());
    }

    private static void validate(TransactionImportRow row) {
        if (row.getDate() == null) {
            throw new IllegalArgumentException("Missing date");
        }
        if (row.getAccountId() == null || row.getAccountId().isBlank()) {
            throw new IllegalArgumentException("Missing account id");
        }
        requireWholeCents("debit", row.getDebit());
        requireWholeCents("credit", row.getCredit());
        Money debit = Money.orZero(row.getDebit());
        Money credit = Money.orZero(row.getCredit());
        if (debit.isNegative() || credit.isNegative()) {
            throw new IllegalArgumentException("Debit and credit must not be negative");
        }
        if (!debit.isZero() && !credit.isZero()) {
            throw new IllegalArgumentException("Only one of debit and credit may be non-zero");
        }
        if (debit.isZero() && credit.isZero()) {
            throw new IllegalArgumentException("Statement line has no amount");
        }
    }

    /**
     * Money rounds to cents; a sub-cent amount would otherwise be imported as a different value.
     */
    private static void requireWholeCents(String field, BigDecimal amount) {
        if (amount != null && amount.stripTrailingZeros().scale() > Money.SCALE) {
            throw new IllegalArgumentException("Amount " + field + " " + amount.toPlainString()
                    + " has fractions of a cent");
        }
    }

    private static String provenance(String batchId, ImportRow row) {
        return "bulk-import " + batchId + " row " + row.getRowIndex();
    }

    private static ImportReport newReport(String batchId, boolean dryRun) {
        return ImportReport.builder()
                .batchId(batchId)
                .dryRun(dryRun)
                .startedAt(LocalDateTime.now())
                .build();
    }

    private void countRow(ImportOutcome outcome) {
        meterRegistry.counter("reconciliation.import.rows", "outcome", outcome.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    private static void logSummary(String kind, ImportReport report) {
        log.info("{}{} import {} finished. Inserted: {}, Skipped as duplicate: {}, Failed: {}",
                report.isDryRun() ? "[dry-run] " : "", kind, report.getBatchId(),
                report.getInserted(), report.getSkippedAsDuplicate(), report.getFailed());
    }
}
