package com.fintech.bankrec.controller;

import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.dto.ReconciliationStats;
import com.fintech.bankrec.dto.RunRequest;
import com.fintech.bankrec.entity.AuditEntry;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.service.ReconciliationService;
import com.fintech.bankrec.service.ReviewReportWriter;
import com.fintech.bankrec.service.audit.AuditLogService;
import com.fintech.bankrec.service.matching.MatchCandidate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * Operator API for reconciliation runs and maintenance.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Bank transaction to receipt reconciliation API")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final AuditLogService auditLogService;
    private final ReviewReportWriter reviewReportWriter;

    @Operation(
            summary = "Trigger a reconciliation run",
            description = "Matches unmatched receipts to unmatched bank transactions, resolves splits and removes "
                    + "true duplicates. Overrides in the body apply to this run only."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run committed, previewed or aborted",
                    content = @Content(schema = @Schema(implementation = ReconciliationRunSummary.class))),
            @ApiResponse(responseCode = "400", description = "Tolerance out of range"),
            @ApiResponse(responseCode = "409", description = "Reconciliation already in progress"),
            @ApiResponse(responseCode = "500", description = "Run rolled back; see failingItem")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationRunSummary> triggerReconciliation(
            @RequestBody(required = false) RunRequest request) {
        log.info("Manual reconciliation triggered via API");
        ReconciliationRunSummary summary = reconciliationService.reconcile(
                request == null ? RunRequest.defaults() : request);
        if (summary.isRolledBack()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(summary);
        }
        return ResponseEntity.ok(summary);
    }

    @Operation(
            summary = "Dry run with CSV review report",
            description = "Plans a run without applying it and returns the records needing manual review as CSV."
    )
    @PostMapping(value = "/run/review-report", produces = "text/csv")
    public ResponseEntity<String> reviewReport(
            @Parameter(description = "Amount tolerance in cents") @RequestParam(required = false) Long amountToleranceCents,
            @Parameter(description = "Date window in days") @RequestParam(required = false) Integer dateWindowDays) {
        ReconciliationRunSummary summary = reconciliationService.reconcile(RunRequest.builder()
                .dryRun(true)
                .amountToleranceCents(amountToleranceCents)
                .dateWindowDays(dateWindowDays)
                .build());
        StringWriter csv = new StringWriter();
        reviewReportWriter.write(summary, csv);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=review-" + summary.getRunId() + ".csv")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv.toString());
    }

    @Operation(summary = "Cancel the current run", description = "Only honoured before the run starts applying.")
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled", reconciliationService.cancelCurrentRun()));
    }

    @Operation(
            summary = "Get reconciliation statistics",
            description = "Returns counts of matched and unmatched records, split groups and audit entries."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconciliationStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconciliationStats> getStats() {
        return ResponseEntity.ok(reconciliationService.getStats());
    }

    @Operation(summary = "Get unmatched receipts", description = "Receipts with no link and no split group, oldest first.")
    @GetMapping("/receipts/unmatched")
    public ResponseEntity<Page<Receipt>> getUnmatchedReceipts(
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(reconciliationService.unmatchedReceipts(page, size));
    }

    @Operation(summary = "Unlink a receipt", description = "Clears a direct link so the receipt can be re-matched.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Receipt unlinked"),
            @ApiResponse(responseCode = "400", description = "Receipt missing, not linked, or part of a split group")
    })
    @PostMapping("/receipts/{id}/unlink")
    public ResponseEntity<Receipt> unlink(
            @Parameter(description = "Receipt ID") @PathVariable Long id,
            @Parameter(description = "Why the link is removed") @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(reconciliationService.unlinkReceipt(id, reason));
    }

    @Operation(
            summary = "Re-match candidates",
            description = "Ranked candidates for a receipt, including transactions that are already linked."
    )
    @GetMapping("/receipts/{id}/candidates")
    public ResponseEntity<List<MatchCandidate>> candidates(
            @Parameter(description = "Receipt ID") @PathVariable Long id,
            @Parameter(description = "Amount tolerance in cents") @RequestParam(required = false) Long amountToleranceCents,
            @Parameter(description = "Date window in days") @RequestParam(required = false) Integer dateWindowDays) {
        return ResponseEntity.ok(reconciliationService.rematchCandidates(id, amountToleranceCents, dateWindowDays));
    }

    @Operation(summary = "Audit history", description = "Audit entries of one record, oldest first.")
    @GetMapping("/audit/{table}/{id}")
    public ResponseEntity<List<AuditEntry>> auditHistory(
            @Parameter(description = "receipts, banking_transactions or split_groups") @PathVariable String table,
            @Parameter(description = "Record ID") @PathVariable String id) {
        return ResponseEntity.ok(auditLogService.historyOf(table, id));
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the reconciliation service. Used by load balancers and monitoring systems."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        ReconciliationStats stats = reconciliationService.getStats();

        Map<String, Object> health = Map.of(
                "status", "UP",
                "reconciliation", Map.of(
                        "isRunning", stats.isReconciliationRunning(),
                        "unmatchedReceipts", stats.getUnmatchedReceipts(),
                        "unmatchedTransactions", stats.getUnmatchedTransactions()
                )
        );

        return ResponseEntity.ok(health);
    }
}
