package com.fintech.bankrec.scheduler;

import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.exception.ReconciliationException;
import com.fintech.bankrec.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Periodic reconciliation runs, off unless {@code reconciliation.scheduler.enabled} is set.
 * <p>
 * fixedDelay keeps runs from overlapping; the service refuses a concurrent run anyway.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${reconciliation.scheduler.enabled:false}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval-ms:3600000}",
            initialDelayString = "${reconciliation.scheduler.initial-delay-ms:60000}")
    public void runScheduledReconciliation() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping reconciliation run");
            return;
        }

        log.info("Starting scheduled reconciliation at {}", LocalDateTime.now());

        try {
            ReconciliationRunSummary summary = reconciliationService.reconcile();
            logResult(summary);
        } catch (ReconciliationException e) {
            log.warn("Reconciliation skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationRunSummary summary) {
        if (summary.isRolledBack()) {
            log.error("Scheduled run {} rolled back at '{}': {}",
                    summary.getRunId(), summary.getFailingItem(), summary.getErrorMessage());
        } else if (summary.getReceiptsLoaded() == 0 && summary.getTransactionsLoaded() == 0) {
            log.info("Nothing left to reconcile");
        } else if (summary.getFlagged() > 0) {
            log.warn("Scheduled run {} left {} record(s) for manual review",
                    summary.getRunId(), summary.getFlagged());
        }
    }
}
