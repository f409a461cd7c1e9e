package com.raidxp.api.model;

import java.time.Instant;
import java.util.Map;

/**
 * Event log entry as read back from the store.
 */
public record LoggedEvent(long id, Instant timestamp, String type, String actor, Map<String, Object> attributes) {
}
