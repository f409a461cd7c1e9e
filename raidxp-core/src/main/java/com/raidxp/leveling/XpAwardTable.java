package com.raidxp.leveling;

import com.raidxp.api.model.EventTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * XP granted per event type. Unknown types award nothing.
 *
 * <p>The table is external configuration; {@link #defaults()} only applies when
 * the rule document does not carry one.
 */
public final class XpAwardTable {

    private static final XpAwardTable DEFAULTS;

    static {
        Map<String, Integer> awards = new LinkedHashMap<>();
        awards.put(EventTypes.KILL, 100);
        awards.put(EventTypes.HEADSHOT, 25);
        awards.put(EventTypes.SURVIVE, 150);
        awards.put(EventTypes.EXTRACT, 75);
        awards.put(EventTypes.DOGTAG, 30);
        awards.put(EventTypes.DEATH, 0);
        DEFAULTS = new XpAwardTable(awards);
    }

    private final Map<String, Integer> awards;

    private XpAwardTable(Map<String, Integer> awards) {
        this.awards = Collections.unmodifiableMap(awards);
    }

    public static XpAwardTable defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a table from a type-to-award mapping. Type names are upper-cased.
     *
     * @throws IllegalArgumentException on a null or negative award
     */
    public static XpAwardTable of(Map<String, Integer> awards) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        awards.forEach((type, xp) -> {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("XP award has an empty event type");
            }
            if (xp == null || xp < 0) {
                throw new IllegalArgumentException("XP award for " + type + " must be a non-negative integer, got " + xp);
            }
            normalized.put(type.toUpperCase(Locale.ROOT), xp);
        });
        return new XpAwardTable(normalized);
    }

    public int award(String eventType) {
        if (eventType == null) {
            return 0;
        }
        return awards.getOrDefault(eventType.toUpperCase(Locale.ROOT), 0);
    }

    public Map<String, Integer> asMap() {
        return awards;
    }

    @Override
    public String toString() {
        return "XpAwardTable" + awards;
    }
}
