package com.raidxp.api;

import com.raidxp.api.model.LoggedEvent;
import com.raidxp.api.model.PlayerCard;
import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestStanding;

import java.util.List;
import java.util.Optional;

/**
 * Read surface exposed to collaborators (bot commands, admin UI, web API).
 *
 * <p>All queries read committed state straight from the store; there is no cache,
 * so results are as fresh as the last applied event.
 */
public interface ProgressionQueries {

    /**
     * Players ordered by XP descending, then display name.
     *
     * @param limit maximum number of players, must be positive
     */
    List<PlayerCard> topPlayers(int limit);

    Optional<PlayerCard> playerCard(String displayName);

    List<Quest> activeQuests();

    /**
     * Progress of every player on every active quest, grouped by quest and ordered
     * by progress descending.
     */
    List<QuestStanding> questBoard();

    /**
     * One player's progress rows on active quests.
     */
    List<QuestStanding> questProgress(String displayName);

    /**
     * Most recent event log entries, newest first.
     */
    List<LoggedEvent> recentEvents(int limit);
}
