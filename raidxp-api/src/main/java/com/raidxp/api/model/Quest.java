package com.raidxp.api.model;

import java.time.Instant;

/**
 * A time-boxed objective counting events of one type toward a target.
 *
 * @param id        surrogate key
 * @param key       stable natural key, unique across all quests
 * @param title     human readable title
 * @param eventType event type whose occurrences advance the quest
 * @param target    number of events needed to complete
 * @param rewardXp  XP granted to eligible players on completion
 * @param start     start of the validity window
 * @param end       end of the validity window
 * @param active    whether the quest currently accepts progress
 */
public record Quest(
        long id,
        String key,
        String title,
        String eventType,
        int target,
        int rewardXp,
        Instant start,
        Instant end,
        boolean active) {
}
