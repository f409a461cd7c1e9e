package com.raidxp.api.model;

import java.time.Instant;

/**
 * One player's progress toward one quest.
 *
 * @param questKey    natural key of the quest
 * @param questTitle  quest title
 * @param displayName player name
 * @param progress    events counted so far
 * @param target      quest target
 * @param completedAt when the target was first reached, or null
 */
public record QuestStanding(
        String questKey,
        String questTitle,
        String displayName,
        int progress,
        int target,
        Instant completedAt) {

    public boolean completed() {
        return completedAt != null;
    }
}
