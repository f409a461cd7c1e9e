package com.raidxp.api.model;

import java.util.List;
import java.util.Map;

/**
 * Well-known event type tags. Custom types declared in the rule document are
 * plain upper-case strings and need no constant here.
 */
public final class EventTypes {

    public static final String KILL = "KILL";
    public static final String HEADSHOT = "HEADSHOT";
    public static final String DEATH = "DEATH";
    public static final String SURVIVE = "SURVIVE";
    public static final String EXTRACT = "EXTRACT";
    public static final String DOGTAG = "DOGTAG";

    /**
     * Attributes that take part in an event's identity, per well-known type.
     * Types missing from this map use all of their attributes.
     */
    static final Map<String, List<String>> KEY_ATTRIBUTES = Map.of(
            KILL, List.of("victim"),
            HEADSHOT, List.of("victim"),
            DEATH, List.of("killer"),
            SURVIVE, List.of("from"),
            EXTRACT, List.of(),
            DOGTAG, List.of("victim"));

    private EventTypes() {
        throw new AssertionError("No instances");
    }

    public static boolean isWellKnown(String type) {
        return KEY_ATTRIBUTES.containsKey(type);
    }
}
