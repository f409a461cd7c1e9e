package com.raidxp.service.progression;

import com.raidxp.api.IProgressionEngine;
import com.raidxp.api.exceptions.StoreException;
import com.raidxp.api.model.Event;
import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestAcceptance;
import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.Timer;
import com.raidxp.leveling.LevelCurve;
import com.raidxp.leveling.XpAwardTable;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.repository.PlayerRepository;
import com.raidxp.service.repository.QuestRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies extracted events to the progression store.
 *
 * <h2>Unit of work</h2>
 * <p>
 * Each {@link #apply(Event)} runs in one transaction:
 * <ol>
 * <li>skip the event if its fingerprint is already logged,</li>
 * <li>resolve or create the player and touch {@code last_seen},</li>
 * <li>append the event to the log,</li>
 * <li>bump the stat counter mapped to the event type,</li>
 * <li>for eligible players, add the XP award and raise the cached level,</li>
 * <li>advance active quests tracking the type by one,</li>
 * <li>stamp {@code completed_at} on rows reaching their target, once, granting
 * the quest reward to eligible players.</li>
 * </ol>
 * A failure rolls everything back and surfaces as {@link StoreException}.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Applications for the same player are serialized on a per-player lock;
 * different players proceed in parallel.
 */
public class ProgressionEngine implements IProgressionEngine {
    private static final Logger logger = Logger.getLogger(ProgressionEngine.class.getName());

    private final JdbcStore store;
    private final PlayerRepository players = new PlayerRepository();
    private final QuestRepository quests = new QuestRepository();
    private final XpAwardTable awards;
    private final LevelCurve levelCurve;
    private final QuestAcceptance acceptance;
    private final Clock clock;
    private final Tracer tracer;

    private final Map<String, ReentrantLock> playerLocks = new ConcurrentHashMap<>();

    private final MetricsRegistry metrics;
    private final Counter duplicates;
    private final Counter failures;
    private final Counter questsCompleted;
    private final Timer applyTimer;

    private record Outcome(boolean applied, int questsCompleted) {
        static final Outcome DUPLICATE = new Outcome(false, 0);
    }

    public ProgressionEngine(JdbcStore store, XpAwardTable awards, LevelCurve levelCurve,
                             QuestAcceptance acceptance, Clock clock, Tracer tracer, MetricsRegistry metrics) {
        this.store = store;
        this.awards = awards;
        this.levelCurve = levelCurve;
        this.acceptance = acceptance;
        this.clock = clock;
        this.tracer = tracer;
        this.metrics = metrics;
        this.duplicates = metrics.counter("events_duplicate_total");
        this.failures = metrics.counter("event_apply_failures_total");
        this.questsCompleted = metrics.counter("quests_completed_total");
        this.applyTimer = metrics.timer("event_apply");
    }

    @Override
    public boolean apply(Event event) {
        if (event.actor().isBlank()) {
            throw new IllegalArgumentException("Event has no actor: " + event);
        }
        String fingerprint = event.identity().fingerprint();

        Span span = tracer.spanBuilder("apply-event").startSpan();
        ReentrantLock lock = playerLocks.computeIfAbsent(event.actor(), name -> new ReentrantLock());
        Timer.Sample sample = applyTimer.start();
        lock.lock();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("eventType", event.type());
            span.setAttribute("actor", event.actor());

            Outcome outcome = store.inTransaction("apply " + event.type() + " for " + event.actor(),
                    conn -> applyInTransaction(conn, event, fingerprint));

            span.setAttribute("applied", outcome.applied());
            if (outcome.applied()) {
                metrics.counter("events_applied_total", "type", event.type()).increment();
                questsCompleted.increment(outcome.questsCompleted());
            } else {
                duplicates.increment();
                logger.fine(() -> "Skipping already applied " + event.type() + " for " + event.actor());
            }
            return outcome.applied();
        } catch (RuntimeException e) {
            failures.increment();
            span.recordException(e);
            logger.log(Level.WARNING, "Failed to apply " + event.type() + " for " + event.actor(), e);
            throw e;
        } finally {
            lock.unlock();
            sample.stop();
            span.end();
        }
    }

    private Outcome applyInTransaction(Connection conn, Event event, String fingerprint) throws SQLException {
        if (players.eventLogged(conn, fingerprint)) {
            return Outcome.DUPLICATE;
        }
        Instant now = clock.instant();

        PlayerRepository.PlayerRow player = players.upsert(conn, event.actor(), now);
        players.logEvent(conn, event, fingerprint, now);
        players.incrementStat(conn, player.id(), event.type());

        if (player.eligible()) {
            grantXp(conn, player.id(), awards.award(event.type()));
        }

        for (Quest quest : quests.findTracking(conn, event.type(), now)) {
            if (acceptance == QuestAcceptance.IMPLICIT) {
                quests.createProgress(conn, quest.id(), player.id(), now);
            }
            quests.advance(conn, quest.id(), player.id());
        }

        // completion covers every reached row of the player, not only the quests advanced above
        int completed = 0;
        for (Quest quest : quests.findReached(conn, player.id())) {
            if (quests.completeIfReached(conn, quest, player.id(), now)) {
                completed++;
                logger.info("Player " + event.actor() + " completed quest " + quest.key());
                if (player.eligible()) {
                    grantXp(conn, player.id(), quest.rewardXp());
                }
            }
        }
        return new Outcome(true, completed);
    }

    private void grantXp(Connection conn, long playerId, int amount) throws SQLException {
        if (amount <= 0) {
            return;
        }
        PlayerRepository.XpLevel current = players.xpForUpdate(conn, playerId);
        long xp = current.xp() + amount;
        int level = Math.max(current.level(), levelCurve.levelFromXp(xp));
        players.updateXp(conn, playerId, new PlayerRepository.XpLevel(xp, level));
    }
}
