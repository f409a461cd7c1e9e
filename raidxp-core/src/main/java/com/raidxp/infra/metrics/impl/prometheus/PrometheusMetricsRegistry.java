package com.raidxp.infra.metrics.impl.prometheus;

import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exports counters and timers to a Prometheus {@link CollectorRegistry}.
 *
 * <p>Metric names get the {@code raidxp_} namespace; timers become histograms in
 * seconds named {@code <name>_seconds}. Each name is registered once with the
 * label it was first used with.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    static final String NAMESPACE = "raidxp";

    // event application is a handful of small SQL statements
    private static final double[] LATENCY_BUCKETS = {0.0005, 0.001, 0.0025, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 1.0};

    private record RegisteredCounter(io.prometheus.client.Counter collector, String[] labelNames) {
    }

    private final CollectorRegistry registry;
    private final Map<String, RegisteredCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name) {
        return adapt(counterCollector(name), name);
    }

    @Override
    public Counter counter(String name, String label, String value) {
        return adapt(counterCollector(name, label), name, value);
    }

    @Override
    public Timer timer(String name) {
        Histogram.Child histogram = histograms.computeIfAbsent(name, n -> Histogram.build()
                .namespace(NAMESPACE)
                .name(metricName(n) + "_seconds")
                .help("Latency of " + n)
                .buckets(LATENCY_BUCKETS)
                .register(registry))
                .labels();
        return duration -> {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Negative duration for " + name + ": " + duration);
            }
            histogram.observe(duration.toNanos() / 1e9);
        };
    }

    private io.prometheus.client.Counter counterCollector(String name, String... labelNames) {
        RegisteredCounter registered = counters.computeIfAbsent(name, n -> new RegisteredCounter(
                io.prometheus.client.Counter.build()
                        .namespace(NAMESPACE)
                        .name(metricName(n))
                        .help("Total of " + n)
                        .labelNames(labelNames)
                        .register(registry),
                labelNames.clone()));
        if (!Arrays.equals(registered.labelNames(), labelNames)) {
            throw new IllegalArgumentException("Metric " + name + " is registered with labels "
                    + Arrays.toString(registered.labelNames()) + ", not " + Arrays.toString(labelNames));
        }
        return registered.collector();
    }

    private static Counter adapt(io.prometheus.client.Counter collector, String name, String... labelValues) {
        io.prometheus.client.Counter.Child series = collector.labels(labelValues);
        return new Counter() {
            @Override
            public void increment(long amount) {
                if (amount < 0) {
                    throw new IllegalArgumentException("Counter " + name + " cannot go down: " + amount);
                }
                series.inc(amount);
            }

            @Override
            public long count() {
                // whole increments only, so the double is exact
                return (long) series.get();
            }
        };
    }

    static String metricName(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_:]", "_");
    }
}
