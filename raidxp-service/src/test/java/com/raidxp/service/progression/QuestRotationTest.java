package com.raidxp.service.progression;

import com.raidxp.api.model.EventTypes;
import com.raidxp.api.model.Quest;
import com.raidxp.api.model.QuestDraft;
import com.raidxp.api.model.QuestSeed;
import com.raidxp.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.raidxp.service.MutableClock;
import com.raidxp.service.StoreFixture;
import com.raidxp.service.repository.JdbcStore;
import com.raidxp.service.service.ProgressionQueryService;
import com.raidxp.service.service.QuestManagementService;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestRotationTest {

    private static final Instant START = Instant.parse("2024-06-15T12:00:00Z");
    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");
    private static final List<QuestSeed> SEEDS = List.of(
            new QuestSeed("dogtags_week", "Collect 5 dog tags", EventTypes.DOGTAG, 5, 0),
            new QuestSeed("survive_week", "Survive 5 raids", EventTypes.SURVIVE, 5, 100));

    private MutableClock clock;
    private InMemoryMetricsRegistry metrics;
    private JdbcStore store;
    private ProgressionQueryService queries;
    private QuestRotation rotation;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        metrics = new InMemoryMetricsRegistry();
        store = StoreFixture.newStore();
        queries = new ProgressionQueryService(store);
        rotation = new QuestRotation(store, SEEDS, 7, clock, TRACER, metrics);
    }

    @Test
    void seedsCurrentCycleWhenNothingIsActive() {
        QuestRotation.Result result = rotation.rotate();

        assertThat(result).isEqualTo(new QuestRotation.Result(0, 2));
        assertThat(queries.activeQuests()).hasSize(2).allMatch(Quest::active);
    }

    @Test
    void repeatedRotationDoesNotDuplicate() {
        rotation.rotate();
        QuestRotation.Result again = rotation.rotate();

        List<Quest> active = queries.activeQuests();
        assertThat(again).isEqualTo(new QuestRotation.Result(0, 0));
        assertThat(active).extracting(Quest::key)
                .containsExactly("dogtags_week-2024-W24", "survive_week-2024-W24");
        assertThat(active.get(1).rewardXp()).isEqualTo(100);
        assertThat(active.get(0).end()).isEqualTo(START.plus(Duration.ofDays(7)));
        assertThat(metrics.getCounterValue("quests_seeded_total")).isEqualTo(2L);
    }

    @Test
    void retiresExpiredQuestsAndSeedsNextCycle() {
        rotation.rotate();
        clock.advance(Duration.ofDays(8));

        QuestRotation.Result result = rotation.rotate();

        assertThat(result).isEqualTo(new QuestRotation.Result(2, 2));
        assertThat(queries.activeQuests()).extracting(Quest::key)
                .containsExactly("dogtags_week-2024-W25", "survive_week-2024-W25");
    }

    @Test
    void doesNotSeedWhileQuestsAreActive() {
        new QuestManagementService(store, clock, TRACER).createQuest(new QuestDraft("custom", "Custom",
                EventTypes.KILL, 10, 0, START, START.plus(Duration.ofDays(30))));

        QuestRotation.Result result = rotation.rotate();

        assertThat(result.seeded()).isZero();
        assertThat(queries.activeQuests()).extracting(Quest::key).containsExactly("custom");
    }

    @Test
    void cycleKeysFollowIsoWeeksAndDays() {
        QuestRotation daily = new QuestRotation(store, SEEDS, 1, clock, TRACER, metrics);

        assertThat(rotation.cycleKey(Instant.parse("2024-12-30T00:00:00Z"))).isEqualTo("2025-W01");
        assertThat(rotation.cycleKey(Instant.parse("2024-01-07T23:59:59Z"))).isEqualTo("2024-W01");
        assertThat(daily.cycleKey(START)).isEqualTo("2024-06-15");
    }

    @Test
    void rejectsNonPositiveCycle() {
        assertThatThrownBy(() -> new QuestRotation(store, SEEDS, 0, clock, TRACER, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
