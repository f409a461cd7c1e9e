package com.raidxp.infra.metrics;

/**
 * A count that only goes up, such as lines read or events applied.
 */
public interface Counter {

    void increment(long amount);

    default void increment() {
        increment(1);
    }

    /** Current total of this series. */
    long count();
}
