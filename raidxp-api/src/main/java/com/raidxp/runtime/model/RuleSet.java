package com.raidxp.runtime.model;

import com.raidxp.api.model.QuestSeed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable, compiled form of the rule document.
 *
 * <p>
 * Built once at startup by the rule compiler and shared read-only by the
 * extractor and the progression components. There is no mutation path; a new
 * rule document requires a restart.
 */
public final class RuleSet {

    /**
     * One compiled extraction rule.
     *
     * @param eventType  upper-case event type
     * @param pattern    compiled pattern
     * @param groupNames named capture groups declared by the pattern, in order
     */
    public record CompiledRule(String eventType, Pattern pattern, List<String> groupNames) {
        public CompiledRule {
            groupNames = List.copyOf(groupNames);
        }
    }

    private final List<CompiledRule> rules;
    private final List<String> headshotKeywords;
    private final Map<String, Integer> xpAwards;
    private final List<QuestSeed> questSeeds;
    private final int questCycleDays;

    private RuleSet(Builder builder) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
        this.headshotKeywords = List.copyOf(builder.headshotKeywords);
        this.xpAwards = Collections.unmodifiableMap(new LinkedHashMap<>(builder.xpAwards));
        this.questSeeds = List.copyOf(builder.questSeeds);
        this.questCycleDays = builder.questCycleDays;
    }

    /** Rules in configuration order. */
    public List<CompiledRule> getRules() {
        return rules;
    }

    public List<String> getHeadshotKeywords() {
        return headshotKeywords;
    }

    /** XP award per upper-case event type. */
    public Map<String, Integer> getXpAwards() {
        return xpAwards;
    }

    public List<QuestSeed> getQuestSeeds() {
        return questSeeds;
    }

    public int getQuestCycleDays() {
        return questCycleDays;
    }

    public int getNumRules() {
        return rules.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<CompiledRule> rules = new ArrayList<>();
        private List<String> headshotKeywords = List.of();
        private Map<String, Integer> xpAwards = Map.of();
        private List<QuestSeed> questSeeds = List.of();
        private int questCycleDays = 7;

        private Builder() {
        }

        public Builder addRule(CompiledRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder withHeadshotKeywords(List<String> keywords) {
            this.headshotKeywords = keywords;
            return this;
        }

        public Builder withXpAwards(Map<String, Integer> awards) {
            this.xpAwards = awards;
            return this;
        }

        public Builder withQuestSeeds(List<QuestSeed> seeds) {
            this.questSeeds = seeds;
            return this;
        }

        public Builder withQuestCycleDays(int days) {
            this.questCycleDays = days;
            return this;
        }

        public RuleSet build() {
            return new RuleSet(this);
        }
    }
}
