package com.fintech.bankrec.service.imports;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A bank statement line: {@code accountId, date, debit, credit, description}.
 */
@Value
@Builder
public class TransactionImportRow implements ImportRow {

    int rowIndex;
    String accountId;
    LocalDate date;

    @Builder.Default
    BigDecimal debit = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal credit = BigDecimal.ZERO;

    String description;
}
