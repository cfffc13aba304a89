package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.entity.PaymentMethod;
import com.fintech.bankrec.exception.ReconciliationErrorType;
import com.fintech.bankrec.exception.ReconciliationException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads receipt and bank statement CSV files into typed import rows.
 * <p>
 * Columns are located by header name, so column order does not matter and unknown
 * columns are ignored. A row that fails to parse is reported with its index and the
 * remaining rows are still read.
 */
@Component
@Slf4j
public class CsvImportReader {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH));

    public CsvReadResult<ReceiptImportRow> readReceipts(Reader source) {
        List<ReceiptImportRow> rows = new ArrayList<>();
        List<ImportFailure> failures = new ArrayList<>();

        try (CSVReader csvReader = new CSVReader(source)) {
            Header header = Header.read(csvReader, "date", "vendor", "amount");
            String[] line;
            int rowIndex = 0;
            while ((line = csvReader.readNext()) != null) {
                if (isBlankLine(line)) {
                    continue;
                }
                rowIndex++;
                try {
                    rows.add(ReceiptImportRow.builder()
                            .rowIndex(rowIndex)
                            .date(parseDate(header.required(line, "date")))
                            .vendor(header.required(line, "vendor"))
                            .amount(parseAmount(header.required(line, "amount")))
                            .description(header.optional(line, "description").orElse(null))
                            .glAccount(header.optional(line, "gl_account").orElse(null))
                            .paymentMethod(PaymentMethod.fromText(header.optional(line, "payment_method").orElse(null)))
                            .sourceReference(header.optional(line, "source_reference").orElse(null))
                            .vehicleId(header.optional(line, "vehicle_id").orElse(null))
                            .employeeId(header.optional(line, "employee_id").orElse(null))
                            .reserveNumber(header.optional(line, "reserve_number").orElse(null))
                            .build());
                } catch (IllegalArgumentException e) {
                    log.debug("Receipt row {} rejected: {}", rowIndex, e.getMessage());
                    failures.add(new ImportFailure(rowIndex, e.getMessage()));
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Unreadable receipt CSV: " + e.getMessage(), e);
        }

        log.info("Read {} receipt row(s), {} unparseable", rows.size(), failures.size());
        return new CsvReadResult<>(rows, failures);
    }

    public CsvReadResult<TransactionImportRow> readTransactions(Reader source) {
        List<TransactionImportRow> rows = new ArrayList<>();
        List<ImportFailure> failures = new ArrayList<>();

        try (CSVReader csvReader = new CSVReader(source)) {
            Header header = Header.read(csvReader, "account_id", "date");
            String[] line;
            int rowIndex = 0;
            while ((line = csvReader.readNext()) != null) {
                if (isBlankLine(line)) {
                    continue;
                }
                rowIndex++;
                try {
                    BigDecimal debit = header.optional(line, "debit").map(CsvImportReader::parseAmount)
                            .orElse(BigDecimal.ZERO);
                    BigDecimal credit = header.optional(line, "credit").map(CsvImportReader::parseAmount)
                            .orElse(BigDecimal.ZERO);
                    rows.add(TransactionImportRow.builder()
                            .rowIndex(rowIndex)
                            .accountId(header.required(line, "account_id"))
                            .date(parseDate(header.required(line, "date")))
                            .debit(debit)
                            .credit(credit)
                            .description(header.optional(line, "description").orElse(null))
                            .build());
                } catch (IllegalArgumentException e) {
                    log.debug("Statement row {} rejected: {}", rowIndex, e.getMessage());
                    failures.add(new ImportFailure(rowIndex, e.getMessage()));
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                    "Unreadable statement CSV: " + e.getMessage(), e);
        }

        log.info("Read {} statement row(s), {} unparseable", rows.size(), failures.size());
        return new CsvReadResult<>(rows, failures);
    }

    static LocalDate parseDate(String value) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value.trim(), format);
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        throw new IllegalArgumentException("Unparseable date '" + value + "'");
    }

    /**
     * Accepts currency symbols, thousands separators and accounting-style parentheses.
     */
    static BigDecimal parseAmount(String value) {
        String cleaned = value.trim().replace("$", "").replace(",", "");
        boolean negative = cleaned.startsWith("(") && cleaned.endsWith(")");
        if (negative) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            BigDecimal amount = new BigDecimal(cleaned);
            return negative ? amount.negate() : amount;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unparseable amount '" + value + "'");
        }
    }

    private static boolean isBlankLine(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Column positions by normalised header name.
     */
    private static final class Header {

        private static final Map<String, String> ALIASES = Map.ofEntries(
                Map.entry("receipt_date", "date"),
                Map.entry("transaction_date", "date"),
                Map.entry("vendor_name", "vendor"),
                Map.entry("gross_amount", "amount"),
                Map.entry("gl_code", "gl_account"),
                Map.entry("account", "account_id"),
                Map.entry("account_number", "account_id"),
                Map.entry("debit_amount", "debit"),
                Map.entry("credit_amount", "credit"),
                Map.entry("reference", "source_reference"));

        private final Map<String, Integer> positions;

        private Header(Map<String, Integer> positions) {
            this.positions = positions;
        }

        static Header read(CSVReader csvReader, String... requiredColumns)
                throws IOException, CsvValidationException {
            String[] names = csvReader.readNext();
            if (names == null) {
                throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST, "CSV file is empty");
            }
            Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < names.length; i++) {
                String normalized = normalize(names[i]);
                positions.putIfAbsent(ALIASES.getOrDefault(normalized, normalized), i);
            }
            for (String column : requiredColumns) {
                if (!positions.containsKey(column)) {
                    throw new ReconciliationException(ReconciliationErrorType.INVALID_REQUEST,
                            "CSV header is missing required column '" + column + "'");
                }
            }
            return new Header(positions);
        }

        String required(String[] line, String column) {
            return optional(line, column)
                    .orElseThrow(() -> new IllegalArgumentException("Missing value for '" + column + "'"));
        }

        Optional<String> optional(String[] line, String column) {
            Integer position = positions.get(column);
            if (position == null || position >= line.length) {
                return Optional.empty();
            }
            String value = line[position];
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        private static String normalize(String name) {
            String cleaned = name == null ? "" : name.replace("\uFEFF", "");
            return cleaned.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        }
    }
}
