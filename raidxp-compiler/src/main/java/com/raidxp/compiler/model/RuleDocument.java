package com.raidxp.compiler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * YAML/JSON representation of the rule document, used only for loading.
 *
 * <pre>
 * patterns:
 *   KILL: '^(?&lt;ts&gt;\S+ \S+) .* KILL: (?&lt;killer&gt;\S+) -&gt; (?&lt;victim&gt;\S+)'
 * headshot_keywords: [HEADSHOT, HS]
 * xp: {KILL: 100, HEADSHOT: 25}
 * quests:
 *   - {key: dogtags_week, title: Collect 5 dog tags, event_type: DOGTAG, target: 5}
 * quest_cycle_days: 7
 * </pre>
 */
public record RuleDocument(
        @JsonProperty("patterns") LinkedHashMap<String, String> patterns,
        @JsonProperty("headshot_keywords") List<String> headshotKeywords,
        @JsonProperty("xp") LinkedHashMap<String, Object> xp,
        @JsonProperty("quests") List<QuestSeedDefinition> quests,
        @JsonProperty("quest_cycle_days") Integer questCycleDays
) {
    /**
     * DTO for one quest seed.
     */
    public record QuestSeedDefinition(
            @JsonProperty("key") String key,
            @JsonProperty("title") String title,
            @JsonProperty("event_type") String eventType,
            @JsonProperty("target") Integer target,
            @JsonProperty("reward_xp") Integer rewardXp
    ) {}

    public Integer questCycleDays() {
        return questCycleDays != null ? questCycleDays : 7;
    }
}
