package com.fintech.bankrec.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the reconciled tables before a run mutates them.
 * <p>
 * DDL commits implicitly on most databases, so this runs before the applying
 * transaction opens, never inside it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackupService {

    static final List<String> TABLES = List.of("receipts", "banking_transactions");

    private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return names of the backup tables created
     */
    public List<String> snapshot() {
        String suffix = LocalDateTime.now().format(SUFFIX);
        List<String> created = new ArrayList<>();
        for (String table : TABLES) {
            String backupTable = table + "_backup_" + suffix;
            jdbcTemplate.execute("CREATE TABLE " + backupTable + " AS SELECT * FROM " + table);
            created.add(backupTable);
            log.info("Backed up {} to {}", table, backupTable);
        }
        return created;
    }
}
