package com.fintech.bankrec.service.duplicate;

import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.service.matching.VendorSimilarity;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognises bank fees (NSF, e-transfer, service charges) and their reversals.
 * <p>
 * Patterns match whole words only, so {@code NSF} does not fire inside "TRANSFER".
 */
public class FeePatternMatcher {

    private final List<Pattern> patterns;

    public FeePatternMatcher(Collection<String> feePatterns) {
        this.patterns = feePatterns.stream()
                .map(p -> Pattern.compile("\\b(?:" + p + ")\\b", Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    public boolean isFee(Receipt receipt) {
        return matches(receipt.effectiveVendor()) || matches(receipt.getDescription());
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    /**
     * A fee counts as reversed when the same vendor shows the negated amount.
     */
    public boolean hasReversal(Receipt fee, Collection<Receipt> history) {
        String vendorKey = VendorSimilarity.vendorKey(fee.effectiveVendor());
        return history.stream()
                .filter(other -> other != fee)
                .filter(other -> other.getAmount() != null)
                .filter(other -> VendorSimilarity.vendorKey(other.effectiveVendor()).equals(vendorKey))
                .anyMatch(other -> other.amountAsMoney().equals(fee.amountAsMoney().negate()));
    }
}
