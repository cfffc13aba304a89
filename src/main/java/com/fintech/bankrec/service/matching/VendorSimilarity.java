package com.fintech.bankrec.service.matching;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Case-insensitive vendor-to-description similarity on a 0..1 scale.
 */
public final class VendorSimilarity {

    /**
     * Scores at or above this count as a vendor match.
     */
    public static final double MATCH_THRESHOLD = 0.5;

    private VendorSimilarity() {
    }

    /**
     * Exact match scores 1.0, substring containment 0.9, otherwise the share of vendor
     * tokens found in the description (scaled to 0.8) or the Jaccard overlap, whichever
     * is higher.
     */
    public static double score(String vendor, String description) {
        String v = normalize(vendor);
        String d = normalize(description);
        if (v.isEmpty() || d.isEmpty()) {
            return 0.0;
        }
        if (v.equals(d)) {
            return 1.0;
        }
        if (d.contains(v) || v.contains(d)) {
            return 0.9;
        }

        Set<String> vendorTokens = tokens(v);
        Set<String> descriptionTokens = tokens(d);
        if (vendorTokens.isEmpty() || descriptionTokens.isEmpty()) {
            return 0.0;
        }
        long common = vendorTokens.stream().filter(descriptionTokens::contains).count();
        Set<String> union = new LinkedHashSet<>(vendorTokens);
        union.addAll(descriptionTokens);

        double coverage = 0.8 * common / vendorTokens.size();
        double jaccard = (double) common / union.size();
        return Math.max(coverage, jaccard);
    }

    public static boolean matches(String vendor, String description) {
        return score(vendor, description) >= MATCH_THRESHOLD;
    }

    /**
     * Upper-case key used to group and compare vendors.
     */
    public static String vendorKey(String vendor) {
        return vendor == null ? "" : vendor.trim().toUpperCase(Locale.ROOT);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", " ")
                .trim();
    }

    private static Set<String> tokens(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .filter(token -> token.length() > 1)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
