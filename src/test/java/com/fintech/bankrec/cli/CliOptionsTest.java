package com.fintech.bankrec.cli;

import com.fintech.bankrec.dto.RunRequest;
import com.fintech.bankrec.exception.ReconciliationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Paths;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    @DisplayName("No command means web mode")
    void noCommand() {
        assertThat(parse("--server.port=9090")).isEmpty();
    }

    @Test
    @DisplayName("Reconcile with overrides")
    void reconcileWithOverrides() {
        CliOptions options = parse("reconcile", "--dry-run", "--amount-tolerance-cents=2",
                "--date-window-days=10", "--review-report=out/review.csv").orElseThrow();

        assertThat(options.getCommand()).isEqualTo(CliCommand.RECONCILE);
        assertThat(options.getReviewReport()).isEqualTo(Paths.get("out/review.csv"));

        RunRequest request = options.toRunRequest();
        assertThat(request.getDryRun()).isTrue();
        assertThat(request.getBackup()).isNull();
        assertThat(request.getAmountToleranceCents()).isEqualTo(2L);
        assertThat(request.getDateWindowDays()).isEqualTo(10);
    }

    @Test
    @DisplayName("Import takes a file and an optional batch id")
    void importCommand() {
        CliOptions options = parse("import-receipts", "receipts.csv", "--batch-id=jan-2019").orElseThrow();

        assertThat(options.getCommand()).isEqualTo(CliCommand.IMPORT_RECEIPTS);
        assertThat(options.getFile()).isEqualTo(Paths.get("receipts.csv"));
        assertThat(options.batchIdOr("fallback")).isEqualTo("jan-2019");

        CliOptions unnamed = parse("import-transactions", "stmt.csv").orElseThrow();
        assertThat(unnamed.batchIdOr("stmt.csv")).isEqualTo("stmt.csv");
    }

    @Test
    @DisplayName("Malformed command lines are rejected")
    void invalid() {
        assertThatThrownBy(() -> parse("rebuild")).isInstanceOf(ReconciliationException.class);
        assertThatThrownBy(() -> parse("import-receipts")).isInstanceOf(ReconciliationException.class);
        assertThatThrownBy(() -> parse("reconcile", "extra.csv")).isInstanceOf(ReconciliationException.class);
        assertThatThrownBy(() -> parse("reconcile", "--amount-tolerance-cents=lots"))
                .isInstanceOf(ReconciliationException.class)
                .hasMessageContaining("amount-tolerance-cents");
    }

    private static Optional<CliOptions> parse(String... args) {
        return CliOptions.parse(new DefaultApplicationArguments(args));
    }
}
