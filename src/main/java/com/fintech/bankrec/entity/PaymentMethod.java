package com.fintech.bankrec.entity;

import java.util.Locale;

/**
 * How a receipt was paid.
 */
public enum PaymentMethod {
    CASH,
    CHECK,
    CARD,
    BANK_TRANSFER,
    TRADE_OF_SERVICE,
    UNKNOWN;

    /**
     * Lenient parse for import files; anything unrecognised is {@link #UNKNOWN}.
     */
    public static PaymentMethod fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (normalized) {
            case "CHEQUE":
                return CHECK;
            case "DEBIT", "CREDIT_CARD", "DEBIT_CARD", "VISA", "MASTERCARD":
                return CARD;
            case "E_TRANSFER", "ETRANSFER", "TRANSFER", "EFT":
                return BANK_TRANSFER;
            case "TRADE":
                return TRADE_OF_SERVICE;
            default:
                break;
        }
        try {
            return PaymentMethod.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
