package com.raidxp.infra.metrics.internal;

import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.infra.metrics.Timer;

import java.time.Duration;

enum NoOpMetricsRegistry implements MetricsRegistry, Counter, Timer {
    INSTANCE;

    @Override
    public Counter counter(String name) {
        return this;
    }

    @Override
    public Counter counter(String name, String label, String value) {
        return this;
    }

    @Override
    public Timer timer(String name) {
        return this;
    }

    @Override
    public void increment(long amount) {
    }

    @Override
    public long count() {
        return 0;
    }

    @Override
    public void record(Duration duration) {
    }
}
