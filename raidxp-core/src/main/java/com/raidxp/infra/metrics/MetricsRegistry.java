package com.raidxp.infra.metrics;

import com.raidxp.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Source of the counters and timers the ingestion pipeline reports.
 *
 * <p>Components receive a registry through their constructor. Production wiring
 * passes {@link #getInstance()}; tests pass an in-memory registry and assert on it.
 * A metric name always carries the same label, or none: mixing the two forms
 * under one name is rejected by registries that export to a backend.
 */
public interface MetricsRegistry {

    /** Unlabelled counter, created on first use. */
    Counter counter(String name);

    /**
     * Counter series for one label value, e.g. {@code counter("events_applied_total", "type", "KILL")}.
     */
    Counter counter(String name, String label, String value);

    Timer timer(String name);

    /**
     * Process-wide registry chosen from the providers on the class path.
     *
     * @see com.raidxp.infra.metrics.api.MetricsRegistryProvider
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
