package com.fintech.bankrec.service.imports;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one import batch. In dry-run mode {@code inserted} counts the rows that
 * would have been inserted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportReport {

    private String batchId;
    private boolean dryRun;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int inserted = 0;

    @Builder.Default
    private int skippedAsDuplicate = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private List<ImportFailure> failures = new ArrayList<>();

    @Builder.Default
    private List<Long> insertedIds = new ArrayList<>();

    public void record(ImportOutcome outcome) {
        switch (outcome) {
            case INSERTED -> inserted++;
            case SKIPPED_DUPLICATE -> skippedAsDuplicate++;
            case FAILED -> failed++;
        }
    }

    public void addFailure(int rowIndex, String message) {
        failed++;
        failures.add(new ImportFailure(rowIndex, message));
    }

    public int getTotalRows() {
        return inserted + skippedAsDuplicate + failed;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
