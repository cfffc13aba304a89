package com.fintech.bankrec.service.imports;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the live column list of the receipts table from JDBC metadata.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportSchemaProvider {

    static final String RECEIPTS_TABLE = "receipts";

    private final JdbcTemplate jdbcTemplate;

    public ImportSchema currentSchema() {
        Set<String> columns = jdbcTemplate.execute((ConnectionCallback<Set<String>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            Set<String> found = readColumns(metaData, RECEIPTS_TABLE);
            if (found.isEmpty()) {
                // H2 and Oracle report unquoted identifiers upper-cased.
                found = readColumns(metaData, RECEIPTS_TABLE.toUpperCase(Locale.ROOT));
            }
            return found;
        });
        log.debug("Receipts table defines {} column(s)", columns == null ? 0 : columns.size());
        return new ImportSchema(columns == null ? Set.of() : Set.copyOf(columns));
    }

    private static Set<String> readColumns(DatabaseMetaData metaData, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
