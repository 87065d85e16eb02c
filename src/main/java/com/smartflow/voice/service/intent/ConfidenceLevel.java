package com.smartflow.voice.service.intent;

/**
 * Coarse confidence of a keyword match and its numeric score.
 */
public enum ConfidenceLevel {
    HIGH(0.95),
    MEDIUM(0.75),
    LOW(0.0);

    private final double score;

    ConfidenceLevel(double score) {
        this.score = score;
    }

    public double getScore() {
        return score;
    }

    static ConfidenceLevel fromMatchScore(int matchScore) {
        if (matchScore >= 3) {
            return HIGH;
        }
        return matchScore >= 2 ? MEDIUM : LOW;
    }
}
