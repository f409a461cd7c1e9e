package com.raidxp.api.model;

import java.util.Locale;

/**
 * How a player becomes associated with an active quest.
 */
public enum QuestAcceptance {
    /** A progress row is created on the first matching event. */
    IMPLICIT,
    /** Only rows created by an explicit accept are advanced. */
    EXPLICIT;

    public static QuestAcceptance fromString(String value) {
        if (value == null || value.isBlank()) {
            return IMPLICIT;
        }
        return QuestAcceptance.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
