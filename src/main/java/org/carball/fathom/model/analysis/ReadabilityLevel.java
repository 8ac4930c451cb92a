package org.carball.fathom.model.analysis;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Qualitative verdict for a readability score. Each level covers the half-open
 * interval [lowerBound, next level's lowerBound).
 */
@Getter
public enum ReadabilityLevel {
    TRIVIAL(0, "trivial"),
    EASY(1, "easy"),
    VERY_READABLE(2, "very readable"),
    READABLE(3, "readable"),
    EASIER_THAN_THE_NORM(4, "easier than the norm"),
    MATURE(5, "mature"),
    COMPLEX(6, "complex"),
    VERY_DIFFICULT(7, "very difficult"),
    OBFUSCATED(8, "obfuscated");

    private final int lowerBound;
    private final String label;

    ReadabilityLevel(int lowerBound, String label) {
        this.lowerBound = lowerBound;
        this.label = label;
    }

    /**
     * Picks the level for the score {@code numerator / denominator}. The comparison is
     * exact, so a score that lands on a bound gets the higher level.
     */
    public static ReadabilityLevel fromScore(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new IllegalArgumentException("Score denominator must be positive: " + denominator);
        }
        ReadabilityLevel[] levels = values();
        for (int i = levels.length - 1; i > 0; i--) {
            if (numerator.compareTo(denominator.multiply(BigInteger.valueOf(levels[i].lowerBound))) >= 0) {
                return levels[i];
            }
        }
        return TRIVIAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
