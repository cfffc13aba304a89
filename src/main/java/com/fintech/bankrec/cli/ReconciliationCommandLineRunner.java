package com.fintech.bankrec.cli;

import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import com.fintech.bankrec.service.BackupService;
import com.fintech.bankrec.service.ReconciliationService;
import com.fintech.bankrec.service.ReviewReportWriter;
import com.fintech.bankrec.service.imports.CsvImportReader;
import com.fintech.bankrec.service.imports.IdempotentImporter;
import com.fintech.bankrec.service.imports.ImportFailure;
import com.fintech.bankrec.service.imports.ImportReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

/**
 * Runs a single command given on the command line and records its exit code.
 * Does nothing when the application is started without a command.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_INVALID_ARGUMENTS = 2;

    private final ReconciliationService reconciliationService;
    private final IdempotentImporter importer;
    private final CsvImportReader csvImportReader;
    private final ReviewReportWriter reviewReportWriter;
    private final BackupService backupService;

    private volatile int exitCode = EXIT_OK;
    private volatile boolean commandExecuted;

    @Override
    public void run(ApplicationArguments args) {
        Optional<CliOptions> parsed;
        try {
            parsed = CliOptions.parse(args);
        } catch (ReconciliationException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            commandExecuted = true;
            exitCode = EXIT_INVALID_ARGUMENTS;
            return;
        }
        if (parsed.isEmpty()) {
            return;
        }
        commandExecuted = true;
        exitCode = execute(parsed.get());
    }

    int execute(CliOptions options) {
        try {
            switch (options.getCommand()) {
                case IMPORT_RECEIPTS:
                    return importFile(options, true);
                case IMPORT_TRANSACTIONS:
                    return importFile(options, false);
                case RECONCILE:
                default:
                    return reconcile(options);
            }
        } catch (ReconciliationException e) {
            if (e.getErrorType() == ReconciliationErrorType.TOLERANCE_VIOLATION
                    || e.getErrorType() == ReconciliationErrorType.INVALID_REQUEST) {
                log.error("Invalid arguments: {}", e.getMessage());
                return EXIT_INVALID_ARGUMENTS;
            }
            log.error("{} failed: {}", options.getCommand().getName(), e.getMessage(), e);
            return EXIT_FAILURES;
        }
    }

    private int reconcile(CliOptions options) {
        ReconciliationRunSummary summary = reconciliationService.reconcile(options.toRunRequest());

        if (options.getReviewReport() != null) {
            try (Writer writer = Files.newBufferedWriter(options.getReviewReport(), StandardCharsets.UTF_8)) {
                reviewReportWriter.write(summary, writer);
            } catch (IOException e) {
                log.error("Could not write review report to {}", options.getReviewReport(), e);
                return EXIT_FAILURES;
            }
        }

        log.info("Run {} ended {}: matched={}, splitGroups={}, duplicatesRemoved={}, shadowReceipts={}, flagged={}",
                summary.getRunId(), summary.getFinalState(), summary.getMatched(), summary.getSplitGroups(),
                summary.getDuplicatesRemoved(), summary.getShadowReceipts(), summary.getFlagged());
        if (summary.isRolledBack()) {
            log.error("Run rolled back at '{}': {}", summary.getFailingItem(), summary.getErrorMessage());
            return EXIT_FAILURES;
        }
        return EXIT_OK;
    }

    private int importFile(CliOptions options, boolean receipts) {
        String batchId = options.batchIdOr(options.getFile().getFileName().toString());
        ImportReport report;
        try (Reader reader = Files.newBufferedReader(options.getFile(), StandardCharsets.UTF_8)) {
            if (Boolean.TRUE.equals(options.getBackup()) && !options.isDryRun()) {
                List<String> tables = backupService.snapshot();
                log.info("Backed up {} before importing batch {}", tables, batchId);
            }
            report = receipts
                    ? importer.importReceipts(batchId, csvImportReader.readReceipts(reader), options.isDryRun())
                    : importer.importTransactions(batchId, csvImportReader.readTransactions(reader), options.isDryRun());
        } catch (IOException e) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Cannot read " + options.getFile() + ": " + e.getMessage(), e);
        }

        log.info("Batch {}{}: inserted={}, skipped_as_duplicate={}, failed={}",
                batchId, report.isDryRun() ? " (dry run)" : "",
                report.getInserted(), report.getSkippedAsDuplicate(), report.getFailed());
        for (ImportFailure failure : report.getFailures()) {
            log.warn("Row {}: {}", failure.getRowIndex(), failure.getMessage());
        }
        return report.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    }

    public boolean isCommandExecuted() {
        return commandExecuted;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
