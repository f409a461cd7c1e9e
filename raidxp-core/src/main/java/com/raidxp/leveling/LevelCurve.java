package com.raidxp.leveling;

/**
 * Maps total experience to a level.
 *
 * <p>Implementations must be strictly increasing in level for levels above 1 and
 * return 0 for level 1 and below, so that {@link #levelFromXp(long)} is a
 * deterministic, non-decreasing function of XP.
 */
public interface LevelCurve {

    /**
     * Minimum total XP needed to hold {@code level}.
     */
    long xpRequired(int level);

    /**
     * Largest level whose requirement is reachable with {@code xp}.
     */
    default int levelFromXp(long xp) {
        int level = 1;
        while (xp >= xpRequired(level + 1)) {
            level++;
        }
        return level;
    }
}
