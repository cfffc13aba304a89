package com.fintech.bankrec.controller;

import com.fintech.bankrec.dto.ReconciliationRunSummary;
import com.fintech.bankrec.dto.ReconciliationStats;
import com.fintech.bankrec.dto.RunRequest;
import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import com.fintech.bankrec.exception.ToleranceViolationException;
import com.fintech.bankrec.service.ReconciliationService;
import com.fintech.bankrec.service.ReviewReportWriter;
import com.fintech.bankrec.service.RunState;
import com.fintech.bankrec.service.audit.AuditLogService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReconciliationController.class)
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationService reconciliationService;

    @MockBean
    private AuditLogService auditLogService;

    @MockBean
    private ReviewReportWriter reviewReportWriter;

    @Test
    @DisplayName("Committed run returns its summary")
    void runCommitted() throws Exception {
        when(reconciliationService.reconcile(any(RunRequest.class))).thenReturn(ReconciliationRunSummary.builder()
                .runId("run-1")
                .finalState(RunState.COMMITTED)
                .matched(3)
                .build());

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.matched").value(3));
    }

    @Test
    @DisplayName("Rolled back run is reported as a server error with the failing item")
    void runRolledBack() throws Exception {
        when(reconciliationService.reconcile(any(RunRequest.class))).thenReturn(ReconciliationRunSummary.builder()
                .runId("run-2")
                .finalState(RunState.ROLLED_BACK)
                .failingItem("link receipt #1 -> transaction #10")
                .build());

        mockMvc.perform(post("/api/v1/reconciliation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dryRun\":false}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.failingItem").value("link receipt #1 -> transaction #10"));
    }

    @Test
    @DisplayName("Tolerance out of range is rejected with the offending parameter")
    void toleranceRejected() throws Exception {
        when(reconciliationService.reconcile(any(RunRequest.class)))
                .thenThrow(new ToleranceViolationException("amountToleranceCents", 50000, 10000));

        mockMvc.perform(post("/api/v1/reconciliation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountToleranceCents\":50000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Tolerance Violation"))
                .andExpect(jsonPath("$.details.parameter").value("amountToleranceCents"))
                .andExpect(jsonPath("$.details.suppliedValue").value(50000));
    }

    @Test
    @DisplayName("Second run while one is in progress is a conflict")
    void runInProgress() throws Exception {
        when(reconciliationService.reconcile(any(RunRequest.class)))
                .thenThrow(new ReconciliationException(ReconciliationErrorType.RUN_IN_PROGRESS,
                        "Reconciliation is already in progress"));

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RUN_IN_PROGRESS"));
    }

    @Test
    @DisplayName("Health reports unmatched counts")
    void health() throws Exception {
        when(reconciliationService.getStats()).thenReturn(ReconciliationStats.builder()
                .unmatchedReceipts(4)
                .unmatchedTransactions(2)
                .build());

        mockMvc.perform(get("/api/v1/reconciliation/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.reconciliation.unmatchedReceipts").value(4))
                .andExpect(jsonPath("$.reconciliation.isRunning").value(false));
    }

    @Test
    @DisplayName("Non-numeric receipt id is a bad request")
    void invalidReceiptId() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliation/receipts/abc/candidates"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));
    }
}
