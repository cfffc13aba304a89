package com.fintech.bankrec.controller;

import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import com.fintech.bankrec.service.imports.CsvImportReader;
import com.fintech.bankrec.service.imports.IdempotentImporter;
import com.fintech.bankrec.service.imports.ImportReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Upload endpoints for receipt and bank statement CSV batches.
 */
@RestController
@RequestMapping("/api/v1/reconciliation/imports")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Imports", description = "Idempotent CSV batch imports")
public class ImportController {

    private final CsvImportReader csvImportReader;
    private final IdempotentImporter importer;

    @Operation(summary = "Import receipts",
            description = "Rows matching an existing receipt on vendor, amount and date are skipped.")
    @ApiResponse(responseCode = "200", description = "Batch processed",
            content = @Content(schema = @Schema(implementation = ImportReport.class)))
    @PostMapping(value = "/receipts", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importReceipts(
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Batch identifier recorded in the audit log") @RequestParam(required = false) String batchId,
            @Parameter(description = "Report only, insert nothing") @RequestParam(defaultValue = "false") boolean dryRun) {
        String batch = batchIdFor(batchId, file);
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importer.importReceipts(batch, csvImportReader.readReceipts(reader), dryRun));
        } catch (IOException e) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Could not read uploaded file " + file.getOriginalFilename(), e);
        }
    }

    @Operation(summary = "Import bank statement lines",
            description = "Lines already imported are skipped; identical lines within one file are kept apart.")
    @ApiResponse(responseCode = "200", description = "Batch processed",
            content = @Content(schema = @Schema(implementation = ImportReport.class)))
    @PostMapping(value = "/transactions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importTransactions(
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Batch identifier recorded in the audit log") @RequestParam(required = false) String batchId,
            @Parameter(description = "Report only, insert nothing") @RequestParam(defaultValue = "false") boolean dryRun) {
        String batch = batchIdFor(batchId, file);
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importer.importTransactions(batch, csvImportReader.readTransactions(reader), dryRun));
        } catch (IOException e) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Could not read uploaded file " + file.getOriginalFilename(), e);
        }
    }

    private static String batchIdFor(String batchId, MultipartFile file) {
        if (batchId != null && !batchId.isBlank()) {
            return batchId.trim();
        }
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "upload-" + System.currentTimeMillis() : name;
    }
}
