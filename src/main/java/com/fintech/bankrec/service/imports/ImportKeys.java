package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.service.matching.VendorSimilarity;
import com.fintech.bankrec.value.Money;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Natural-key hashes stored in the unique {@code import_key} columns.
 */
public final class ImportKeys {

    private ImportKeys() {
    }

    public static String receiptKey(String vendor, BigDecimal amount, LocalDate date) {
        return sha256("R|" + VendorSimilarity.vendorKey(vendor) + "|" + Money.of(amount).toBigDecimal().toPlainString()
                + "|" + date);
    }

    /**
     * Statement lines carry no id of their own, so identical lines in one file are told
     * apart by their occurrence ordinal within the batch.
     */
    public static String transactionKey(String baseKey, int occurrence) {
        return baseKey + ":" + occurrence;
    }

    public static String transactionBaseKey(String accountId, LocalDate date, BigDecimal debit,
                                            BigDecimal credit, String description) {
        String normalizedDescription = description == null ? ""
                : description.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        return sha256("T|" + accountId.trim() + "|" + date
                + "|" + Money.orZero(debit).toBigDecimal().toPlainString()
                + "|" + Money.orZero(credit).toBigDecimal().toPlainString()
                + "|" + normalizedDescription);
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
