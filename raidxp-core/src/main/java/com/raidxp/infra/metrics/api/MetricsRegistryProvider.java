package com.raidxp.infra.metrics.api;

import com.raidxp.infra.metrics.MetricsRegistry;

/**
 * Pluggable metrics backend, discovered with {@link java.util.ServiceLoader}
 * from {@code META-INF/services/com.raidxp.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <p>Setting {@code RAIDXP_METRICS} (environment or system property) to a
 * provider {@link #id()} selects it; otherwise the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    /** Short selector, e.g. {@code prometheus}. */
    String id();

    MetricsRegistry create();

    default int priority() {
        return 0;
    }
}
