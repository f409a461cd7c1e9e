package com.raidxp.infra.metrics.impl.prometheus;

import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    void counterAccumulatesAcrossLookups() {
        metrics.counter("events_applied_total").increment();
        metrics.counter("events_applied_total").increment(4);

        assertThat(metrics.counter("events_applied_total").count()).isEqualTo(5L);
        assertThat(collectorRegistry.getSampleValue("raidxp_events_applied_total")).isEqualTo(5.0);
    }

    @Test
    void eventTypesAreSeparateSeries() {
        metrics.counter("events_extracted_total", "type", "KILL").increment();
        metrics.counter("events_extracted_total", "type", "DEATH").increment(3);

        assertThat(collectorRegistry.getSampleValue("raidxp_events_extracted_total",
                new String[]{"type"}, new String[]{"KILL"})).isEqualTo(1.0);
        assertThat(collectorRegistry.getSampleValue("raidxp_events_extracted_total",
                new String[]{"type"}, new String[]{"DEATH"})).isEqualTo(3.0);
    }

    @Test
    void labelMismatchIsRejected() {
        metrics.counter("events_extracted_total", "type", "KILL");

        assertThatThrownBy(() -> metrics.counter("events_extracted_total"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registered with labels [type]");
    }

    @Test
    void countersNeverGoDown() {
        Counter counter = metrics.counter("lines_read_total");

        assertThatThrownBy(() -> counter.increment(-5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot go down");
    }

    @Test
    void timerObservesSecondsHistogram() {
        Timer timer = metrics.timer("event_apply");

        timer.record(Duration.ofMillis(3));
        try (Timer.Sample sample = timer.start()) {
            assertThat(sample).isNotNull();
        }

        assertThat(collectorRegistry.getSampleValue("raidxp_event_apply_seconds_count")).isEqualTo(2.0);
        assertThat(collectorRegistry.getSampleValue("raidxp_event_apply_seconds_sum")).isGreaterThanOrEqualTo(0.003);
        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
