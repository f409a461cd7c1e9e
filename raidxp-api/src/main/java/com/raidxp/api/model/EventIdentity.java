package com.raidxp.api.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identity tuple of an {@link Event}: {@code (type, timestamp, actor, key attribute values)}.
 *
 * <p>Two events with equal identities describe the same logical occurrence. The
 * extractor uses this to drop overlapping rule matches on one line, the event log
 * stores its {@link #fingerprint()} to make re-application a no-op.
 */
public record EventIdentity(String type, Instant timestamp, String actor, List<String> keyValues) {

    public EventIdentity {
        keyValues = List.copyOf(keyValues);
    }

    static EventIdentity of(Event event) {
        List<String> keys = EventTypes.KEY_ATTRIBUTES.get(event.type());
        List<String> values = new ArrayList<>();
        if (keys != null) {
            for (String key : keys) {
                values.add(event.attribute(key));
            }
        } else {
            for (Map.Entry<String, Object> e : new TreeMap<>(event.attributes()).entrySet()) {
                values.add(e.getKey() + "=" + e.getValue());
            }
        }
        return new EventIdentity(event.type(), event.timestamp(), event.actor(), values);
    }

    /**
     * Stable SHA-256 hex digest of this identity.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder()
                .append(type).append('\u001f')
                .append(timestamp).append('\u001f')
                .append(actor);
        for (String value : keyValues) {
            sb.append('\u001f').append(value);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
