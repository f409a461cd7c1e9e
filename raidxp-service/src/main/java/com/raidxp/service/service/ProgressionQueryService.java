package com.raidxp.service.service;

import com.raidxp.api.ProgressionQueries;
import com.raidxp.api.model.LoggedEvent;
import com.raidxp.api.model.PlayerCard;
import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestStanding;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.repository.PlayerRepository;
import com.raidxp.service.repository.QuestRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read surface over the progression store. No caching: every call sees the last
 * committed event.
 */
public class ProgressionQueryService implements ProgressionQueries {

    private final JdbcStore store;
    private final PlayerRepository players = new PlayerRepository();
    private final QuestRepository quests = new QuestRepository();

    public ProgressionQueryService(JdbcStore store) {
        this.store = store;
    }

    @Override
    public List<PlayerCard> topPlayers(int limit) {
        requirePositive(limit);
        return store.read("read top players", conn -> players.topByXp(conn, limit));
    }

    @Override
    public Optional<PlayerCard> playerCard(String displayName) {
        return store.read("read player card", conn -> players.findCard(conn, displayName));
    }

    @Override
    public List<Quest> activeQuests() {
        return store.read("read active quests", quests::findActive);
    }

    @Override
    public List<QuestStanding> questBoard() {
        return store.read("read quest board", quests::board);
    }

    @Override
    public List<QuestStanding> questProgress(String displayName) {
        return store.read("read quest progress", conn -> quests.standingsOf(conn, displayName));
    }

    @Override
    public List<LoggedEvent> recentEvents(int limit) {
        requirePositive(limit);
        return store.read("read recent events", conn -> players.recentEvents(conn, limit));
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
    }
}
