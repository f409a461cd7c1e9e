package com.raidxp.service.progression;

import com.raidxp.api.model.QuestDraft;
import com.raidxp.api.model.QuestSeed;
import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.repository.QuestRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retires expired quests and seeds the next cycle when none are active.
 *
 * <p>Seeded quests are keyed {@code <seed key>-<cycle>} where the cycle is the ISO
 * week ({@code 2024-W01}) for cycles that are whole weeks and the UTC date
 * otherwise. A seed whose cycle key already exists is left alone, so running
 * {@link #rotate()} repeatedly within a cycle never duplicates quests.
 */
public class QuestRotation {
    private static final Logger logger = Logger.getLogger(QuestRotation.class.getName());

    /** Quests retired and seeded by one rotation. */
    public record Result(int deactivated, int seeded) {
    }

    private final JdbcStore store;
    private final QuestRepository quests = new QuestRepository();
    private final List<QuestSeed> seeds;
    private final Duration cycleLength;
    private final Clock clock;
    private final Tracer tracer;
    private final Counter seededCounter;
    private final ScheduledExecutorService rotationExecutor;

    public QuestRotation(JdbcStore store, List<QuestSeed> seeds, int cycleDays, Clock clock,
                         Tracer tracer, MetricsRegistry metrics) {
        if (cycleDays <= 0) {
            throw new IllegalArgumentException("Quest cycle must be at least one day: " + cycleDays);
        }
        this.store = store;
        this.seeds = List.copyOf(seeds);
        this.cycleLength = Duration.ofDays(cycleDays);
        this.clock = clock;
        this.tracer = tracer;
        this.seededCounter = metrics.counter("quests_seeded_total");
        this.rotationExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Quest-Rotation");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Rotates once now, failing fast, then every {@code interval} in the background.
     */
    public void start(Duration interval) {
        rotate();
        long millis = interval.toMillis();
        rotationExecutor.scheduleAtFixedRate(this::rotateQuietly, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Quest rotation scheduled every " + interval);
    }

    public void shutdown() {
        rotationExecutor.shutdownNow();
    }

    /**
     * Deactivates quests whose window has ended and, if no quest is left active,
     * seeds the current cycle.
     */
    public Result rotate() {
        Span span = tracer.spanBuilder("rotate-quests").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Instant now = clock.instant();
            String cycle = cycleKey(now);
            span.setAttribute("cycle", cycle);

            Result result = store.inTransaction("rotate quests", conn -> {
                int deactivated = quests.deactivateExpired(conn, now);
                int seeded = 0;
                if (quests.countActive(conn) == 0) {
                    for (QuestSeed seed : seeds) {
                        String key = seed.key() + "-" + cycle;
                        if (quests.findByKey(conn, key).isPresent()) {
                            continue;
                        }
                        quests.insert(conn, new QuestDraft(key, seed.title(), seed.eventType(),
                                seed.target(), seed.rewardXp(), now, now.plus(cycleLength)));
                        seeded++;
                    }
                }
                return new Result(deactivated, seeded);
            });

            seededCounter.increment(result.seeded());
            span.setAttribute("deactivated", result.deactivated());
            span.setAttribute("seeded", result.seeded());
            logger.info(String.format("Quest rotation for cycle %s: %d retired, %d seeded",
                    cycle, result.deactivated(), result.seeded()));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    String cycleKey(Instant now) {
        LocalDate date = now.atZone(ZoneOffset.UTC).toLocalDate();
        if (cycleLength.toDays() % 7 == 0) {
            return String.format("%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
        return date.toString();
    }

    private void rotateQuietly() {
        try {
            rotate();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Scheduled quest rotation failed, retrying next interval", e);
        }
    }
}
