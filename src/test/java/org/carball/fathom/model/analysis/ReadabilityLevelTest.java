package org.carball.fathom.model.analysis;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReadabilityLevelTest {

    private static ReadabilityLevel level(long numerator, long denominator) {
        return ReadabilityLevel.fromScore(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    @Test
    void shouldMapEachBracket() {
        assertThat(level(1, 2)).isEqualTo(ReadabilityLevel.TRIVIAL);
        assertThat(level(3, 2)).isEqualTo(ReadabilityLevel.EASY);
        assertThat(level(256, 100)).isEqualTo(ReadabilityLevel.VERY_READABLE);
        assertThat(level(7, 2)).isEqualTo(ReadabilityLevel.READABLE);
        assertThat(level(9, 2)).isEqualTo(ReadabilityLevel.EASIER_THAN_THE_NORM);
        assertThat(level(11, 2)).isEqualTo(ReadabilityLevel.MATURE);
        assertThat(level(13, 2)).isEqualTo(ReadabilityLevel.COMPLEX);
        assertThat(level(15, 2)).isEqualTo(ReadabilityLevel.VERY_DIFFICULT);
        assertThat(level(42, 1)).isEqualTo(ReadabilityLevel.OBFUSCATED);
    }

    @Test
    void shouldPlaceExactBoundariesInHigherBracket() {
        ReadabilityLevel[] levels = ReadabilityLevel.values();
        for (int boundary = 1; boundary <= 8; boundary++) {
            assertThat(level(boundary, 1))
                    .as("score %d.00", boundary)
                    .isEqualTo(levels[boundary]);
            assertThat(level(boundary * 1000L - 1, 1000))
                    .as("score just below %d", boundary)
                    .isEqualTo(levels[boundary - 1]);
        }
    }

    @Test
    void shouldCompareFractionsExactly() {
        // 168000 / 56000 is exactly 3
        assertThat(level(168_000, 56_000)).isEqualTo(ReadabilityLevel.READABLE);
        assertThat(level(167_999, 56_000)).isEqualTo(ReadabilityLevel.VERY_READABLE);
    }

    @Test
    void shouldRejectNonPositiveDenominator() {
        assertThatThrownBy(() -> level(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTreatZeroAsTrivial() {
        assertThat(level(0, 1)).isEqualTo(ReadabilityLevel.TRIVIAL);
        assertThat(ReadabilityLevel.TRIVIAL.getLabel()).isEqualTo("trivial");
        assertThat(ReadabilityLevel.EASIER_THAN_THE_NORM).hasToString("easier than the norm");
    }

    @Test
    void shouldPluralizeCounterLabels() {
        assertThat(Counter.TOKENS.label(1)).isEqualTo("token");
        assertThat(Counter.TOKENS.label(0)).isEqualTo("tokens");
        assertThat(Counter.SUBROUTINES.label(2)).isEqualTo("subroutines");
        assertThat(Counter.EXPRESSIONS.getPlural()).isEqualTo("expressions");
    }
}
