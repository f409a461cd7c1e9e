package com.raidxp.service.service;

import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestDraft;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.repository.PlayerRepository;
import com.raidxp.service.repository.QuestRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Administrative quest operations.
 *
 * <p>These never touch progress counters or completion stamps: editing or
 * deactivating a quest leaves what players already earned in place.
 */
public class QuestManagementService {
    private static final Logger logger = Logger.getLogger(QuestManagementService.class.getName());

    private final JdbcStore store;
    private final PlayerRepository players = new PlayerRepository();
    private final QuestRepository quests = new QuestRepository();
    private final Clock clock;
    private final Tracer tracer;

    public QuestManagementService(JdbcStore store, Clock clock, Tracer tracer) {
        this.store = store;
        this.clock = clock;
        this.tracer = tracer;
    }

    /**
     * Creates an active quest.
     *
     * @throws IllegalArgumentException if a quest with the same key exists
     */
    public Quest createQuest(QuestDraft draft) {
        Span span = tracer.spanBuilder("create-quest").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("questKey", draft.key());
            Quest quest = store.inTransaction("create quest " + draft.key(), conn -> {
                if (quests.findByKey(conn, draft.key()).isPresent()) {
                    throw new IllegalArgumentException("Quest with key '" + draft.key() + "' already exists");
                }
                return quests.insert(conn, draft);
            });
            logger.info("Created quest " + quest.key() + " tracking " + quest.eventType());
            return quest;
        } finally {
            span.end();
        }
    }

    /**
     * Updates title, target, reward and window of an existing quest.
     *
     * @return the updated quest, or empty if no quest has the key
     * @throws IllegalArgumentException if the draft changes the tracked event type
     */
    public Optional<Quest> updateQuest(QuestDraft draft) {
        Span span = tracer.spanBuilder("update-quest").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("questKey", draft.key());
            return store.inTransaction("update quest " + draft.key(), conn -> {
                Optional<Quest> existing = quests.findByKey(conn, draft.key());
                if (existing.isEmpty()) {
                    return Optional.<Quest>empty();
                }
                if (!existing.get().eventType().equals(draft.eventType())) {
                    throw new IllegalArgumentException("Quest '" + draft.key() + "' tracks "
                            + existing.get().eventType() + "; event type cannot change");
                }
                quests.update(conn, draft);
                return quests.findByKey(conn, draft.key());
            });
        } finally {
            span.end();
        }
    }

    /**
     * @return {@code true} if the quest was active and is now inactive
     */
    public boolean deactivateQuest(String key) {
        boolean deactivated = store.inTransaction("deactivate quest " + key, conn -> quests.deactivate(conn, key));
        if (deactivated) {
            logger.info("Deactivated quest " + key);
        }
        return deactivated;
    }

    /**
     * Accepts an active quest for a player, creating a zero progress row. Under
     * explicit acceptance only accepted quests advance. Unseen players are created.
     *
     * @return {@code true} if newly accepted, {@code false} if already accepted
     * @throws IllegalArgumentException if the quest does not exist or is inactive
     */
    public boolean acceptQuest(String displayName, String key) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name cannot be blank");
        }
        return store.inTransaction("accept quest " + key + " for " + displayName, conn -> {
            Quest quest = quests.findByKey(conn, key)
                    .filter(Quest::active)
                    .orElseThrow(() -> new IllegalArgumentException("No active quest with key '" + key + "'"));
            Optional<PlayerRepository.PlayerRow> existing = players.findForUpdate(conn, displayName);
            PlayerRepository.PlayerRow player = existing.isPresent()
                    ? existing.get()
                    : players.create(conn, displayName, false, clock.instant());
            return quests.createProgress(conn, quest.id(), player.id(), clock.instant());
        });
    }

    public Optional<Quest> findByKey(String key) {
        return store.read("find quest " + key, conn -> quests.findByKey(conn, key));
    }

    public List<Quest> listQuests() {
        return store.read("list quests", quests::findAll);
    }
}
