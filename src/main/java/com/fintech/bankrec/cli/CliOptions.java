package com.fintech.bankrec.cli;

import com.fintech.bankrec.dto.RunRequest;
import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Command line of a one-shot invocation, e.g.
 * {@code reconcile --dry-run --amount-tolerance-cents=2 --review-report=review.csv}.
 */
@Value
@Builder
public class CliOptions {

    static final String DRY_RUN = "dry-run";
    static final String BACKUP = "backup";
    static final String AMOUNT_TOLERANCE_CENTS = "amount-tolerance-cents";
    static final String DATE_WINDOW_DAYS = "date-window-days";
    static final String BATCH_ID = "batch-id";
    static final String REVIEW_REPORT = "review-report";

    CliCommand command;
    Path file;
    boolean dryRun;
    Boolean backup;
    Long amountToleranceCents;
    Integer dateWindowDays;
    String batchId;
    Path reviewReport;

    /**
     * @return empty when no command was given, meaning the application runs as a web service
     * @throws ReconciliationException with {@link ReconciliationErrorType#INVALID_REQUEST} on a malformed command line
     */
    public static Optional<CliOptions> parse(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return Optional.empty();
        }

        CliCommand command = CliCommand.fromName(positional.get(0))
                .orElseThrow(() -> invalid("Unknown command '" + positional.get(0) + "'"));
        Path file = null;
        if (command.requiresFile()) {
            if (positional.size() != 2) {
                throw invalid(command.getName() + " expects exactly one CSV file");
            }
            file = Paths.get(positional.get(1));
        } else if (positional.size() > 1) {
            throw invalid(command.getName() + " takes no file argument");
        }

        String reviewReport = single(args, REVIEW_REPORT);
        return Optional.of(CliOptions.builder()
                .command(command)
                .file(file)
                .dryRun(args.containsOption(DRY_RUN))
                .backup(args.containsOption(BACKUP) ? Boolean.TRUE : null)
                .amountToleranceCents(parseLong(single(args, AMOUNT_TOLERANCE_CENTS), AMOUNT_TOLERANCE_CENTS))
                .dateWindowDays(parseInt(single(args, DATE_WINDOW_DAYS), DATE_WINDOW_DAYS))
                .batchId(single(args, BATCH_ID))
                .reviewReport(reviewReport == null ? null : Paths.get(reviewReport))
                .build());
    }

    public RunRequest toRunRequest() {
        return RunRequest.builder()
                .dryRun(dryRun)
                .backup(backup)
                .amountToleranceCents(amountToleranceCents)
                .dateWindowDays(dateWindowDays)
                .build();
    }

    public String batchIdOr(String fallback) {
        return batchId == null || batchId.isBlank() ? fallback : batchId;
    }

    private static String single(ApplicationArguments args, String option) {
        if (!args.containsOption(option)) {
            return null;
        }
        List<String> values = args.getOptionValues(option);
        if (values.size() != 1 || values.get(0).isBlank()) {
            throw invalid("--" + option + " expects exactly one value");
        }
        return values.get(0).trim();
    }

    private static Long parseLong(String value, String option) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw invalid("--" + option + " must be a whole number, got '" + value + "'");
        }
    }

    private static Integer parseInt(String value, String option) {
        Long parsed = parseLong(value, option);
        if (parsed == null) {
            return null;
        }
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            throw invalid("--" + option + " is out of range");
        }
        return parsed.intValue();
    }

    private static ReconciliationException invalid(String message) {
        return new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST, message);
    }
}
