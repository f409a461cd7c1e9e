package com.raidxp.api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents an immutable gameplay event extracted from a single log line.
 *
 * <p>
 * An event consists of:
 * <ul>
 * <li><b>timestamp</b>: UTC instant taken from the log line (or processing
 * time when the line carries no parsable timestamp).</li>
 * <li><b>type</b>: event type tag, upper-case (see {@link EventTypes}).</li>
 * <li><b>actor</b>: display name of the player the event is credited to.</li>
 * <li><b>attributes</b>: ordered scalar payload (victim, killer, provenance, ...).</li>
 * </ul>
 *
 * @param timestamp  when the event happened (must not be null)
 * @param type       event type tag (must not be null)
 * @param actor      player display name (must not be null)
 * @param attributes payload, copied and wrapped unmodifiable; insertion order kept
 */
public record Event(
        Instant timestamp,
        String type,
        String actor,
        Map<String, Object> attributes) {

    public Event {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(actor, "actor");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Event(Instant timestamp, String type, String actor) {
        this(timestamp, type, actor, Map.of());
    }

    /**
     * Returns an attribute rendered as a string, or {@code ""} when absent.
     */
    public String attribute(String name) {
        Object value = attributes.get(name);
        return value == null ? "" : value.toString();
    }

    /**
     * Identity used to collapse duplicate emissions of the same logical event.
     */
    public EventIdentity identity() {
        return EventIdentity.of(this);
    }
}
