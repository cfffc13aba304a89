package com.fintech.bankrec.service.matching;

/**
 * Confidence bands. A candidate's score always falls inside its tier's band, so
 * sorting by score never lets a lower tier outrank a higher one.
 */
public enum ConfidenceTier {

    /**
     * Exact amount, dates within three days, vendor match.
     */
    HIGH(0.90, 1.00, "exact-amount+near-date+vendor"),

    /**
     * Exact amount, wider date or no vendor evidence.
     */
    MEDIUM(0.70, 0.90, "exact-amount"),

    /**
     * Amount within $1.00 (fee adjusted) with a vendor match.
     */
    LOW(0.40, 0.70, "fee-adjusted-amount+vendor"),

    /**
     * Inside the caller's windows but with none of the above evidence.
     */
    WEAK(0.00, 0.40, "tolerance-only");

    private final double floor;
    private final double ceiling;
    private final String ruleName;

    ConfidenceTier(double floor, double ceiling, String ruleName) {
        this.floor = floor;
        this.ceiling = ceiling;
        this.ruleName = ruleName;
    }

    /**
     * Maps a 0..1 refinement score into this tier's band.
     */
    public double scale(double refinement) {
        double bounded = Math.max(0.0, Math.min(1.0, refinement));
        return floor + (ceiling - floor) * bounded;
    }

    public double getFloor() {
        return floor;
    }

    public String getRuleName() {
        return ruleName;
    }
}
