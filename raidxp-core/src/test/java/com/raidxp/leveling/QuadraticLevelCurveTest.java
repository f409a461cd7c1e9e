package com.raidxp.leveling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuadraticLevelCurveTest {

    private final LevelCurve curve = QuadraticLevelCurve.defaultCurve();

    @ParameterizedTest
    @CsvSource({"0,0", "1,0", "2,200", "3,500", "4,1000", "5,1700", "11,10100"})
    void xpRequiredFollowsQuadraticFormula(int level, long expected) {
        assertThat(curve.xpRequired(level)).isEqualTo(expected);
    }

    @Test
    @DisplayName("levelFromXp(xpRequired(L)) == L for every level")
    void thresholdMapsBackToItsLevel() {
        for (int level = 1; level <= 500; level++) {
            assertThat(curve.levelFromXp(curve.xpRequired(level)))
                    .as("level %d", level)
                    .isEqualTo(level);
        }
    }

    @Test
    @DisplayName("one XP below a threshold stays on the previous level")
    void justBelowThresholdIsPreviousLevel() {
        for (int level = 2; level <= 500; level++) {
            assertThat(curve.levelFromXp(curve.xpRequired(level) - 1))
                    .as("level %d", level)
                    .isEqualTo(level - 1);
        }
    }

    @Test
    void levelIsNonDecreasingInXp() {
        int previous = curve.levelFromXp(0);
        for (long xp = 0; xp <= 50_000; xp += 7) {
            int level = curve.levelFromXp(xp);
            assertThat(level).isGreaterThanOrEqualTo(previous);
            previous = level;
        }
    }

    @Test
    void smallXpStaysOnLevelOne() {
        assertThat(curve.levelFromXp(0)).isEqualTo(1);
        assertThat(curve.levelFromXp(125)).isEqualTo(1);
        assertThat(curve.levelFromXp(199)).isEqualTo(1);
        assertThat(curve.levelFromXp(200)).isEqualTo(2);
    }

    @Test
    void rejectsNonPositiveStep() {
        assertThatThrownBy(() -> new QuadraticLevelCurve(0, 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("step");
    }
}
