package com.raidxp.infra.metrics.impl.inmemory;

import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.LongAdder;

/**
 * Registry that keeps everything in memory so tests can assert on it.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * new ProgressionEngine(..., metrics).apply(event);
 * assertThat(metrics.getCounterValue("events_applied_total")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private record Series(String name, String label, String value) {
    }

    private final Map<Series, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, Queue<Duration>> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name) {
        return counterFor(new Series(name, null, null));
    }

    @Override
    public Counter counter(String name, String label, String value) {
        return counterFor(new Series(name, label, value));
    }

    @Override
    public Timer timer(String name) {
        Queue<Duration> recordings = timers.computeIfAbsent(name, n -> new ConcurrentLinkedQueue<>());
        return duration -> {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Negative duration for " + name + ": " + duration);
            }
            recordings.add(duration);
        };
    }

    /**
     * Sum over every series of the metric, labelled or not.
     */
    public long getCounterValue(String name) {
        return counters.entrySet().stream()
                .filter(e -> e.getKey().name().equals(name))
                .mapToLong(e -> e.getValue().sum())
                .sum();
    }

    /** Value of one labelled series. */
    public long getCounterValue(String name, String label, String value) {
        LongAdder adder = counters.get(new Series(name, label, value));
        return adder == null ? 0L : adder.sum();
    }

    public List<Duration> getTimerRecordings(String name) {
        Queue<Duration> recordings = timers.get(name);
        return recordings == null ? List.of() : List.copyOf(recordings);
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }

    private Counter counterFor(Series series) {
        LongAdder adder = counters.computeIfAbsent(series, s -> new LongAdder());
        return new Counter() {
            @Override
            public void increment(long amount) {
                if (amount < 0) {
                    throw new IllegalArgumentException("Counter " + series.name() + " cannot go down: " + amount);
                }
                adder.add(amount);
            }

            @Override
            public long count() {
                return adder.sum();
            }
        };
    }
}
