package com.fintech.bankrec.service.matching;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VendorSimilarityTest {

    @Test
    void exactMatchIgnoresCaseAndPunctuation() {
        assertThat(VendorSimilarity.score("Fas Gas", "FAS-GAS")).isEqualTo(1.0);
    }

    @Test
    void containmentScoresHigh() {
        assertThat(VendorSimilarity.score("FAS GAS", "POS PURCHASE FAS GAS #1234 RED DEER")).isEqualTo(0.9);
        assertThat(VendorSimilarity.matches("FAS GAS", "POS PURCHASE FAS GAS #1234 RED DEER")).isTrue();
    }

    @Test
    void partialTokenOverlap() {
        double score = VendorSimilarity.score("Canadian Tire Store", "CDN TIRE STORE 0421");

        assertThat(score).isGreaterThanOrEqualTo(VendorSimilarity.MATCH_THRESHOLD);
        assertThat(score).isLessThan(0.9);
    }

    @Test
    void missingVendorScoresZero() {
        assertThat(VendorSimilarity.score(null, "CHEQUE 1042")).isZero();
        assertThat(VendorSimilarity.score("  ", "CHEQUE 1042")).isZero();
        assertThat(VendorSimilarity.matches("Staples", "SHELL CANADA")).isFalse();
    }

    @Test
    void vendorKeyIsTrimmedUpperCase() {
        assertThat(VendorSimilarity.vendorKey("  Receiver General ")).isEqualTo("RECEIVER GENERAL");
        assertThat(VendorSimilarity.vendorKey(null)).isEmpty();
    }
}
