package com.raidxp.infra.metrics.impl.inmemory;

import com.raidxp.infra.metrics.Timer;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

    @Test
    void countersAreSharedByName() {
        metrics.counter("lines_read_total").increment();
        metrics.counter("lines_read_total").increment(2);

        assertThat(metrics.getCounterValue("lines_read_total")).isEqualTo(3L);
        assertThat(metrics.counter("lines_read_total").count()).isEqualTo(3L);
        assertThat(metrics.getCounterValue("never_touched")).isZero();
    }

    @Test
    void totalSumsLabelledSeries() {
        metrics.counter("events_applied_total", "type", "KILL").increment(2);
        metrics.counter("events_applied_total", "type", "DOGTAG").increment();

        assertThat(metrics.getCounterValue("events_applied_total")).isEqualTo(3L);
        assertThat(metrics.getCounterValue("events_applied_total", "type", "KILL")).isEqualTo(2L);
        assertThat(metrics.getCounterValue("events_applied_total", "type", "DEATH")).isZero();
    }

    @Test
    void timerKeepsRecordings() {
        Timer timer = metrics.timer("event_apply");

        timer.record(Duration.ofMillis(2));
        Duration elapsed = timer.start().stop();

        assertThat(metrics.getTimerRecordings("event_apply")).containsExactly(Duration.ofMillis(2), elapsed);
        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetClearsEverything() {
        metrics.counter("events_applied_total").increment();
        metrics.timer("event_apply").record(Duration.ZERO);

        metrics.reset();

        assertThat(metrics.getCounterValue("events_applied_total")).isZero();
        assertThat(metrics.getTimerRecordings("event_apply")).isEmpty();
    }
}
