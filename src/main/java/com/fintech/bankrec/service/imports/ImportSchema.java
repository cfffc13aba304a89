package com.fintech.bankrec.service.imports;

import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * Columns the {@code receipts} table defines at the time a batch starts.
 */
@Value
public class ImportSchema {

    public static final String VEHICLE_ID = "vehicle_id";
    public static final String EMPLOYEE_ID = "employee_id";
    public static final String RESERVE_NUMBER = "reserve_number";

    Set<String> receiptColumns;

    public boolean supports(String column) {
        return receiptColumns.contains(column.toLowerCase(Locale.ROOT));
    }
}
