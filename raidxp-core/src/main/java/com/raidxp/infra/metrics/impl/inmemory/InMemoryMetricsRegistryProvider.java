package com.raidxp.infra.metrics.impl.inmemory;

import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.api.MetricsRegistryProvider;

/**
 * Selected with {@code RAIDXP_METRICS=memory}; useful for local runs without a scraper.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public String id() {
        return "memory";
    }

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }
}
