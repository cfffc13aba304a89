package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.entity.AuditActionType;
import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.repository.BankingTransactionRepository;
import com.fintech.bankrec.repository.ReceiptRepository;
import com.fintech.bankrec.service.audit.AuditLogService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotentImporterTest {

    private static final LocalDate DATE = LocalDate.of(2025, 12, 23);

    @Mock
    private ReceiptRepository receiptRepository;

    @Mock
    private BankingTransactionRepository transactionRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private ImportSchemaProvider schemaProvider;

    @Mock
    private VendorCanonicalizationClient vendorClient;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private IdempotentImporter importer;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        importer = new IdempotentImporter(receiptRepository, transactionRepository, auditLogService,
                schemaProvider, vendorClient, transactionManager, meterRegistry);
    }

    @Nested
    @DisplayName("Receipts")
    class ReceiptTests {

        @BeforeEach
        void schema() {
            lenient().when(schemaProvider.currentSchema())
                    .thenReturn(new ImportSchema(Set.of("receipt_id", "amount", "vehicle_id")));
        }

        @Test
        @DisplayName("Row identical to an existing receipt is skipped")
        void existingReceiptSkipped() {
            when(receiptRepository.existsByNaturalKey("TEST VENDOR", new BigDecimal("100.00"), DATE)).thenReturn(true);

            ImportReport report = importer.importReceipts("batch-1", List.of(row(1, "Test Vendor", "100.00")), false);

            assertThat(report.getSkippedAsDuplicate()).isEqualTo(1);
            assertThat(report.getInserted()).isZero();
            verify(receiptRepository, never()).saveAndFlush(any());
            verifyNoInteractions(auditLogService);
        }

        @Test
        @DisplayName("New row is inserted with its audit entry and provenance")
        void newReceiptInserted() {
            when(vendorClient.canonicalize("Fas Gas")).thenReturn(Optional.of("FAS GAS"));
            when(receiptRepository.saveAndFlush(any(Receipt.class))).thenAnswer(invocation -> {
                Receipt receipt = invocation.getArgument(0);
                receipt.setReceiptId(ids.incrementAndGet());
                return receipt;
            });

            ReceiptImportRow row = ReceiptImportRow.builder()
                    .rowIndex(3).date(DATE).vendor("Fas Gas").amount(new BigDecimal("62.4"))
                    .vehicleId("L-4").employeeId("E-9")
                    .build();
            ImportReport report = importer.importReceipts("batch-7", List.of(row), false);

            assertThat(report.getInserted()).isEqualTo(1);
            assertThat(report.getInsertedIds()).containsExactly(101L);

            ArgumentCaptor<Receipt> captor = ArgumentCaptor.forClass(Receipt.class);
            verify(receiptRepository).saveAndFlush(captor.capture());
            Receipt saved = captor.getValue();
            assertThat(saved.getCanonicalVendor()).isEqualTo("FAS GAS");
            assertThat(saved.getAmount()).isEqualByComparingTo("62.40");
            assertThat(saved.getVehicleId()).isEqualTo("L-4");
            assertThat(saved.getEmployeeId()).as("column not in schema").isNull();
            assertThat(saved.getImportKey()).isNotBlank();

            verify(auditLogService).record(eq(AuditActionType.INSERT), eq(AuditLogService.RECEIPTS), eq(101L),
                    isNull(), any(), eq("bulk-import batch-7 row 3"), eq("batch-7"));
        }

        @Test
        @DisplayName("Losing an insert race counts as already imported")
        void uniqueViolationIsSkip() {
            when(receiptRepository.saveAndFlush(any(Receipt.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_receipts_import_key"));

            ImportReport report = importer.importReceipts("batch-1", List.of(row(1, "Test Vendor", "100.00")), false);

            assertThat(report.getSkippedAsDuplicate()).isEqualTo(1);
            assertThat(report.getFailed()).isZero();
        }

        @Test
        @DisplayName("Invalid rows fail individually")
        void invalidRowFails() {
            ReceiptImportRow noVendor = ReceiptImportRow.builder()
                    .rowIndex(1).date(DATE).vendor(" ").amount(new BigDecimal("5.00")).build();
            when(receiptRepository.saveAndFlush(any(Receipt.class))).thenAnswer(invocation -> invocation.getArgument(0));

            ImportReport report = importer.importReceipts("batch-1",
                    List.of(noVendor, row(2, "Staples", "5.00")), false);

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getInserted()).isEqualTo(1);
            assertThat(report.getFailures()).singleElement()
                    .satisfies(f -> assertThat(f.getRowIndex()).isEqualTo(1));
            assertThat(meterRegistry.counter("reconciliation.import.rows", "outcome", "failed").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Sub-cent amount fails instead of being rounded onto an existing receipt")
        void subCentAmountFails() {
            ImportReport report = importer.importReceipts("batch-1",
                    List.of(row(1, "Test Vendor", "100.004"), row(2, "Test Vendor", "100.000")), true);

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getSkippedAsDuplicate()).isZero();
            assertThat(report.getInserted()).isEqualTo(1);
            assertThat(report.getFailures()).singleElement().satisfies(f -> {
                assertThat(f.getRowIndex()).isEqualTo(1);
                assertThat(f.getMessage()).contains("fractions of a cent");
            });
        }

        @Test
        @DisplayName("Dry run writes nothing and still detects repeats inside the batch")
        void dryRun() {
            ImportReport report = importer.importReceipts("batch-1",
                    List.of(row(1, "Staples", "5.00"), row(2, "STAPLES", "5.00")), true);

            assertThat(report.isDryRun()).isTrue();
            assertThat(report.getInserted()).isEqualTo(1);
            assertThat(report.getSkippedAsDuplicate()).isEqualTo(1);
            verify(receiptRepository, never()).saveAndFlush(any());
            verifyNoInteractions(auditLogService, transactionManager);
        }

        @Test
        @DisplayName("Parse failures from the CSV reader are carried into the report")
        void parseFailuresCarried() {
            CsvReadResult<ReceiptImportRow> parsed = new CsvReadResult<>(List.of(),
                    List.of(new ImportFailure(4, "Unparseable date 'x'")));

            ImportReport report = importer.importReceipts("batch-1", parsed, false);

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.hasFailures()).isTrue();
        }
    }

    @Nested
    @DisplayName("Statement lines")
    class TransactionTests {

        @Test
        @DisplayName("Two identical lines in one file are both inserted")
        void repeatedLinesKeptApart() {
            when(transactionRepository.saveAndFlush(any(BankingTransaction.class))).thenAnswer(invocation -> {
                BankingTransaction transaction = invocation.getArgument(0);
                transaction.setTransactionId(ids.incrementAndGet());
                return transaction;
            });

            ImportReport report = importer.importTransactions("stmt-1",
                    List.of(fee(1), fee(2)), false);

            assertThat(report.getInserted()).isEqualTo(2);
            ArgumentCaptor<BankingTransaction> captor = ArgumentCaptor.forClass(BankingTransaction.class);
            verify(transactionRepository, times(2)).saveAndFlush(captor.capture());
            assertThat(captor.getAllValues().get(0).getImportKey())
                    .isNotEqualTo(captor.getAllValues().get(1).getImportKey());
        }

        @Test
        @DisplayName("Re-importing the same file skips every line")
        void reimportSkipped() {
            when(transactionRepository.existsByImportKey(anyString())).thenReturn(true);

            ImportReport report = importer.importTransactions("stmt-1", List.of(fee(1), fee(2)), false);

            assertThat(report.getSkippedAsDuplicate()).isEqualTo(2);
            verify(transactionRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("A sub-cent debit is rejected")
        void subCentDebit() {
            TransactionImportRow row = TransactionImportRow.builder()
                    .rowIndex(1).accountId("0228362").date(DATE)
                    .debit(new BigDecimal("1.505"))
                    .build();

            ImportReport report = importer.importTransactions("stmt-1", List.of(row), false);

            assertThat(report.getFailed()).isEqualTo(1);
            verify(transactionRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("A line with both debit and credit is rejected")
        void debitAndCredit() {
            TransactionImportRow row = TransactionImportRow.builder()
                    .rowIndex(1).accountId("0228362").date(DATE)
                    .debit(new BigDecimal("1.00")).credit(new BigDecimal("1.00"))
                    .build();

            ImportReport report = importer.importTransactions("stmt-1", List.of(row), false);

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getFailures().get(0).getMessage()).contains("Only one of debit and credit");
        }
    }

    private static ReceiptImportRow row(int index, String vendor, String amount) {
        return ReceiptImportRow.builder()
                .rowIndex(index)
                .date(DATE)
                .vendor(vendor)
                .amount(new BigDecimal(amount))
                .build();
    }

    private static TransactionImportRow fee(int index) {
        return TransactionImportRow.builder()
                .rowIndex(index)
                .accountId("0228362")
                .date(DATE)
                .debit(new BigDecimal("1.50"))
                .description("E-TRANSFER FEE")
                .build();
    }
}
