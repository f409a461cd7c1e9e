package com.raidxp.api.model;

/**
 * Template for a quest seeded by rotation when no quest is active.
 *
 * @param key       base natural key; rotation appends the cycle label
 * @param title     quest title
 * @param eventType event type to count
 * @param target    events needed
 * @param rewardXp  XP granted on completion
 */
public record QuestSeed(String key, String title, String eventType, int target, int rewardXp) {
}
