package com.fintech.bankrec.service;

import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.dto.ReviewItem;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a run's review items as CSV, one line per candidate (or one line for an item
 * without candidates).
 */
@Component
@Slf4j
public class ReviewReportWriter {

    static final String[] HEADER = {
            "run_id", "entity_table", "entity_id", "reason", "detail", "date", "amount", "vendor",
            "candidate_transaction_id", "confidence", "rule_applied", "amount_delta", "date_delta_days"
    };

    public void write(ReconciliationRunSummary summary, Writer target) {
        List<String[]> lines = new ArrayList<>();
        lines.add(HEADER);
        for (ReviewItem item : summary.getReviewItems()) {
            if (item.getCandidates() == null || item.getCandidates().isEmpty()) {
                lines.add(line(summary.getRunId(), item, null));
            } else {
                for (ReviewItem.CandidateSummary candidate : item.getCandidates()) {
                    lines.add(line(summary.getRunId(), item, candidate));
                }
            }
        }

        try (CSVWriter csvWriter = new CSVWriter(target,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
            csvWriter.writeAll(lines);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write review report", e);
        }
        log.info("Wrote review report for run {} with {} item(s)", summary.getRunId(), summary.getFlagged());
    }

    private static String[] line(String runId, ReviewItem item, ReviewItem.CandidateSummary candidate) {
        return new String[]{
                runId,
                item.getEntityTable(),
                String.valueOf(item.getEntityId()),
                String.valueOf(item.getReason()),
                nullToEmpty(item.getDetail()),
                item.getDate() == null ? "" : item.getDate().toString(),
                item.getAmount() == null ? "" : item.getAmount().toPlainString(),
                nullToEmpty(item.getVendor()),
                candidate == null ? "" : String.valueOf(candidate.getTransactionId()),
                candidate == null ? "" : String.format(Locale.ROOT, "%.4f", candidate.getConfidence()),
                candidate == null ? "" : nullToEmpty(candidate.getRuleApplied()),
                candidate == null || candidate.getAmountDelta() == null ? "" : candidate.getAmountDelta().toPlainString(),
                candidate == null ? "" : String.valueOf(candidate.getDateDeltaDays())
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
