package com.raidxp.api.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Input for creating or updating a quest through the administrative surface.
 */
public record QuestDraft(
        String key,
        String title,
        String eventType,
        int target,
        int rewardXp,
        Instant start,
        Instant end) {

    public QuestDraft {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Quest key cannot be blank");
        }
        if (target <= 0) {
            throw new IllegalArgumentException("Quest target must be positive: " + target);
        }
        if (rewardXp < 0) {
            throw new IllegalArgumentException("Quest reward cannot be negative: " + rewardXp);
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Quest window end must be after start");
        }
        eventType = eventType.toUpperCase(Locale.ROOT);
    }
}
