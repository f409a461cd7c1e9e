package com.raidxp.leveling;

/**
 * {@code xpRequired(level) = step * (level - 1)^2 + base} for levels above 1.
 *
 * <p>With the defaults (100/100) level 2 needs 200 XP, level 3 needs 500, level 4
 * needs 1000.
 */
public final class QuadraticLevelCurve implements LevelCurve {

    public static final long DEFAULT_STEP = 100;
    public static final long DEFAULT_BASE = 100;

    private static final QuadraticLevelCurve DEFAULT = new QuadraticLevelCurve(DEFAULT_STEP, DEFAULT_BASE);

    private final long step;
    private final long base;

    public QuadraticLevelCurve(long step, long base) {
        if (step <= 0) {
            throw new IllegalArgumentException("Curve step must be positive: " + step);
        }
        if (base < 0) {
            throw new IllegalArgumentException("Curve base cannot be negative: " + base);
        }
        this.step = step;
        this.base = base;
    }

    public static QuadraticLevelCurve defaultCurve() {
        return DEFAULT;
    }

    @Override
    public long xpRequired(int level) {
        if (level <= 1) {
            return 0;
        }
        long n = level - 1L;
        return step * n * n + base;
    }

    @Override
    public String toString() {
        return "QuadraticLevelCurve{step=" + step + ", base=" + base + "}";
    }
}
