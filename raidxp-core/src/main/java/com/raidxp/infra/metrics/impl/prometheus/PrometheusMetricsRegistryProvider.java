package com.raidxp.infra.metrics.impl.prometheus;

import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.api.MetricsRegistryProvider;

/**
 * Default provider: series land in the Prometheus default collector registry.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public String id() {
        return "prometheus";
    }

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }
}
