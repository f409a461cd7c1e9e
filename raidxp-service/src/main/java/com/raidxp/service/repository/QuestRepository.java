package com.raidxp.service.repository;

import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestDraft;
import com.raidxp.api.model.QuestStanding;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Quests and per-player quest progress rows.
 */
public class QuestRepository {

    /**
     * Active quests tracking {@code eventType} whose window contains {@code now}.
     */
    public List<Quest> findTracking(Connection conn, String eventType, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_matching_quests"))) {
            stmt.setString(1, eventType);
            stmt.setTimestamp(2, Timestamp.from(now));
            stmt.setTimestamp(3, Timestamp.from(now));
            return mapQuests(stmt);
        }
    }

    public List<Quest> findActive(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_active_quests"))) {
            return mapQuests(stmt);
        }
    }

    public List<Quest> findAll(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_all_quests"))) {
            return mapQuests(stmt);
        }
    }

    public Optional<Quest> findByKey(Connection conn, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_quest_by_key"))) {
            stmt.setString(1, key);
            List<Quest> quests = mapQuests(stmt);
            return quests.isEmpty() ? Optional.empty() : Optional.of(quests.get(0));
        }
    }

    public Quest insert(Connection conn, QuestDraft draft) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("insert_quest"), Statement.RETURN_GENERATED_KEYS)) {
            int idx = 1;
            stmt.setString(idx++, draft.key());
            stmt.setString(idx++, draft.title());
            stmt.setString(idx++, draft.eventType());
            stmt.setInt(idx++, draft.target());
            stmt.setInt(idx++, draft.rewardXp());
            stmt.setTimestamp(idx++, Timestamp.from(draft.start()));
            stmt.setTimestamp(idx, Timestamp.from(draft.end()));
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for quest " + draft.key());
                }
                return new Quest(keys.getLong(1), draft.key(), draft.title(), draft.eventType(),
                        draft.target(), draft.rewardXp(), draft.start(), draft.end(), true);
            }
        }
    }

    /**
     * Rewrites title, target, reward and window. Key and event type never change.
     *
     * @return {@code false} if no quest has the key
     */
    public boolean update(Connection conn, QuestDraft draft) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("update_quest"))) {
            int idx = 1;
            stmt.setString(idx++, draft.title());
            stmt.setInt(idx++, draft.target());
            stmt.setInt(idx++, draft.rewardXp());
            stmt.setTimestamp(idx++, Timestamp.from(draft.start()));
            stmt.setTimestamp(idx++, Timestamp.from(draft.end()));
            stmt.setString(idx, draft.key());
            return stmt.executeUpdate() > 0;
        }
    }

    public boolean deactivate(Connection conn, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("deactivate_quest"))) {
            stmt.setString(1, key);
            return stmt.executeUpdate() > 0;
        }
    }

    public int deactivateExpired(Connection conn, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("deactivate_expired_quests"))) {
            stmt.setTimestamp(1, Timestamp.from(now));
            return stmt.executeUpdate();
        }
    }

    public int countActive(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("count_active_quests"));
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }

    public boolean progressExists(Connection conn, long questId, long playerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("progress_exists"))) {
            stmt.setLong(1, questId);
            stmt.setLong(2, playerId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Creates a zero progress row unless one exists.
     *
     * @return {@code true} if a row was created
     */
    public boolean createProgress(Connection conn, long questId, long playerId, Instant acceptedAt) throws SQLException {
        if (progressExists(conn, questId, playerId)) {
            return false;
        }
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("insert_progress"))) {
            stmt.setLong(1, questId);
            stmt.setLong(2, playerId);
            stmt.setTimestamp(3, Timestamp.from(acceptedAt));
            stmt.executeUpdate();
        }
        return true;
    }

    /**
     * Adds one to an existing progress row.
     *
     * @return {@code false} if the player has no row for the quest
     */
    public boolean advance(Connection conn, long questId, long playerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("increment_progress"))) {
            stmt.setLong(1, questId);
            stmt.setLong(2, playerId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Active quests where the player is at or past the target without a completion stamp.
     */
    public List<Quest> findReached(Connection conn, long playerId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_reached_quests"))) {
            stmt.setLong(1, playerId);
            return mapQuests(stmt);
        }
    }

    /**
     * Sets {@code completed_at} if the row reached the quest target and has not
     * completed before.
     *
     * @return {@code true} only on the call that completed the row
     */
    public boolean completeIfReached(Connection conn, Quest quest, long playerId, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("complete_progress"))) {
            stmt.setTimestamp(1, Timestamp.from(now));
            stmt.setLong(2, quest.id());
            stmt.setLong(3, playerId);
            stmt.setInt(4, quest.target());
            return stmt.executeUpdate() > 0;
        }
    }

    public List<QuestStanding> board(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_quest_board"))) {
            return mapStandings(stmt);
        }
    }

    public List<QuestStanding> standingsOf(Connection conn, String displayName) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(JdbcStore.sql("select_player_quest_progress"))) {
            stmt.setString(1, displayName);
            return mapStandings(stmt);
        }
    }

    private List<Quest> mapQuests(PreparedStatement stmt) throws SQLException {
        List<Quest> quests = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                quests.add(new Quest(
                        rs.getLong("id"),
                        rs.getString("quest_key"),
                        rs.getString("title"),
                        rs.getString("event_type"),
                        rs.getInt("target"),
                        rs.getInt("reward_xp"),
                        rs.getTimestamp("start_ts").toInstant(),
                        rs.getTimestamp("end_ts").toInstant(),
                        rs.getBoolean("active")));
            }
        }
        return quests;
    }

    private List<QuestStanding> mapStandings(PreparedStatement stmt) throws SQLException {
        List<QuestStanding> standings = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                Timestamp completedAt = rs.getTimestamp("completed_at");
                standings.add(new QuestStanding(
                        rs.getString("quest_key"),
                        rs.getString("title"),
                        rs.getString("display_name"),
                        rs.getInt("progress"),
                        rs.getInt("target"),
                        completedAt != null ? completedAt.toInstant() : null));
            }
        }
        return standings;
    }
}
