package com.fintech.bankrec.service.imports;

import lombok.Value;

import java.util.List;

/**
 * Rows that parsed, and the rows that did not. Unparseable rows are reported, never
 * dropped, and never abort the rest of the file.
 */
@Value
public class CsvReadResult<T extends ImportRow> {
    List<T> rows;
    List<ImportFailure> failures;
}
