package com.raidxp.infra.metrics;

import java.time.Duration;

/**
 * Distribution of operation latencies.
 *
 * <pre>{@code
 * Timer.Sample sample = applyTimer.start();
 * try {
 *     ...
 * } finally {
 *     sample.stop();
 * }
 * }</pre>
 */
public interface Timer {

    /**
     * @throws IllegalArgumentException if the duration is negative
     */
    void record(Duration duration);

    /**
     * Starts measuring on the monotonic clock. The elapsed time is recorded when
     * the sample stops.
     */
    default Sample start() {
        long startNanos = System.nanoTime();
        return () -> {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            record(elapsed);
            return elapsed;
        };
    }

    /**
     * One in-flight measurement. Stop it exactly once.
     */
    @FunctionalInterface
    interface Sample extends AutoCloseable {

        /** Records and returns the elapsed time. */
        Duration stop();

        @Override
        default void close() {
            stop();
        }
    }
}
