package com.raidxp.service.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raidxp.api.exceptions.StoreException;
import com.raidxp.api.model.Event;
import com.raidxp.api.model.EventTypes;
import com.raidxp.api.model.LoggedEvent;
import com.raidxp.api.model.PlayerCard;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Players, their stats record and the event log.
 *
 * <p>Every method works on a caller-supplied connection so that several calls
 * share one transaction.
 */
public class PlayerRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private static final Map<String, String> STAT_QUERIES = Map.of(
            EventTypes.KILL, "increment_kills",
            EventTypes.DEATH, "increment_deaths",
            EventTypes.EXTRACT, "increment_extracts",
            EventTypes.SURVIVE, "increment_survivals",
            EventTypes.DOGTAG, "increment_dogtags");

    /** Player id and opt-in flag. */
    public record PlayerRow(long id, boolean eligible) {
    }

    /** Stored XP and cached level. */
    public record XpLevel(long xp, int level) {
    }

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Resolves a player by display name, creating it with a zeroed stats record
     * when unseen; otherwise touches {@code last_seen}. The player row is locked
     * for the rest of the transaction.
     */
    public PlayerRow upsert(Connection conn, String displayName, Instant seenAt) throws SQLException {
        Optional<PlayerRow> existing = findForUpdate(conn, displayName);
        if (existing.isPresent()) {
            PlayerRow player = existing.get();
            try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("touch_player"))) {
                stmt.setTimestamp(1, Timestamp.from(seenAt));
                stmt.setLong(2, player.id());
                stmt.executeUpdate();
            }
            ensureStats(conn, player.id());
            return player;
        }
        return create(conn, displayName, false, seenAt);
    }

    public Optional<PlayerRow> findForUpdate(Connection conn, String displayName) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_player_for_update"))) {
            stmt.setString(1, displayName);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new PlayerRow(rs.getLong("id"), rs.getBoolean("eligible")));
                }
            }
        }
        return Optional.empty();
    }

    public PlayerRow create(Connection conn, String displayName, boolean eligible, Instant seenAt) throws SQLException {
        long id;
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("insert_player"), Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, displayName);
            stmt.setBoolean(2, eligible);
            stmt.setTimestamp(3, Timestamp.from(seenAt));
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for player " + displayName);
                }
                id = keys.getLong(1);
            }
        }
        ensureStats(conn, id);
        return new PlayerRow(id, eligible);
    }

    public void ensureStats(Connection conn, long playerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("stats_exist"))) {
            stmt.setLong(1, playerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return;
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("insert_stats"))) {
            stmt.setLong(1, playerId);
            stmt.executeUpdate();
        }
    }

    public void setEligible(Connection conn, long playerId, boolean eligible) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("set_player_eligible"))) {
            stmt.setBoolean(1, eligible);
            stmt.setLong(2, playerId);
            stmt.executeUpdate();
        }
    }

    /**
     * Increments the stat counter mapped to an event type.
     *
     * @return {@code false} when the type has no counter (e.g. {@code HEADSHOT})
     */
    public boolean incrementStat(Connection conn, long playerId, String eventType) throws SQLException {
        String query = STAT_QUERIES.get(eventType);
        if (query == null) {
            return false;
        }
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql(query))) {
            stmt.setLong(1, playerId);
            stmt.executeUpdate();
        }
        return true;
    }

    public XpLevel xpForUpdate(Connection conn, long playerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_xp_for_update"))) {
            stmt.setLong(1, playerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("No stats record for player " + playerId);
                }
                return new XpLevel(rs.getLong("xp"), rs.getInt("level"));
            }
        }
    }

    public void updateXp(Connection conn, long playerId, XpLevel value) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("update_xp_level"))) {
            stmt.setLong(1, value.xp());
            stmt.setInt(2, value.level());
            stmt.setLong(3, playerId);
            stmt.executeUpdate();
        }
    }

    public boolean eventLogged(Connection conn, String fingerprint) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("event_logged"))) {
            stmt.setString(1, fingerprint);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public void logEvent(Connection conn, Event event, String fingerprint, Instant loggedAt) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("insert_event"))) {
            stmt.setTimestamp(1, Timestamp.from(event.timestamp()));
            stmt.setString(2, event.type());
            stmt.setString(3, event.actor());
            stmt.setString(4, toJson(event.attributes()));
            stmt.setString(5, fingerprint);
            stmt.setTimestamp(6, Timestamp.from(loggedAt));
            stmt.executeUpdate();
        }
    }

    public Optional<PlayerCard> findCard(Connection conn, String displayName) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_player_card"))) {
            stmt.setString(1, displayName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapCard(rs)) : Optional.empty();
            }
        }
    }

    public List<PlayerCard> topByXp(Connection conn, int limit) throws SQLException {
        List<PlayerCard> cards = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_top_players"))) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    cards.add(mapCard(rs));
                }
            }
        }
        return cards;
    }

    public List<LoggedEvent> recentEvents(Connection conn, int limit) throws SQLException {
        List<LoggedEvent> events = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_recent_events"))) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new LoggedEvent(
                            rs.getLong("id"),
                            rs.getTimestamp("ts").toInstant(),
                            rs.getString("type"),
                            rs.getString("actor"),
                            fromJson(rs.getString("attributes"))));
                }
            }
        }
        return events;
    }

    private PlayerCard mapCard(ResultSet rs) throws SQLException {
        return new PlayerCard(
                rs.getString("display_name"),
                rs.getBoolean("eligible"),
                rs.getTimestamp("last_seen").toInstant(),
                rs.getLong("kills"),
                rs.getLong("deaths"),
                rs.getLong("extracts"),
                rs.getLong("survivals"),
                rs.getLong("dogtags"),
                rs.getLong("xp"),
                rs.getInt("level"));
    }

    private String toJson(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize event attributes", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize event attributes", e);
        }
    }
}
