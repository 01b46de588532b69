package com.raditha.quotient.model;

/**
 * Normalized score of one pillar.
 *
 * @param score     Value in [0,1]; 0 when unavailable
 * @param available Whether the pillar could be measured
 * @param reason    Why the pillar is unavailable, null when available
 */
public record PillarScore(double score, boolean available, String reason) {

    public PillarScore {
        if (available && (score < 0.0 || score > 1.0 || Double.isNaN(score))) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got: " + score);
        }
    }

    public static PillarScore of(double score) {
        return new PillarScore(score, true, null);
    }

    public static PillarScore unavailable(String reason) {
        return new PillarScore(0.0, false, reason);
    }
}
