package com.raidxp.service.ingestion;

import com.raidxp.api.IEventExtractor;
import com.raidxp.api.IProgressionEngine;
import com.raidxp.api.exceptions.StoreException;
import com.raidxp.api.model.Event;
import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded ingestion loop: one line at a time, extracted and applied end
 * to end before the next line is read.
 *
 * <p>The source cursor moves past a line only after all of its events applied.
 * When the store fails the events parsed from the line are applied again after a
 * backoff; the line is not re-parsed, so events that already committed keep their
 * identity and are recognized as duplicates. After {@code maxAttempts} consecutive
 * failures the worker stops and reports the failure through {@link #failure()}.
 * Any other runtime failure stops the worker at once and is reported the same way.
 *
 * <p>{@link #stop()} takes effect between lines, never inside an application.
 */
public class IngestionWorker implements Runnable {
    private static final Logger logger = Logger.getLogger(IngestionWorker.class.getName());

    private final LineSource source;
    private final IEventExtractor extractor;
    private final IProgressionEngine engine;
    private final Duration pollInterval;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Counter linesRead;

    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private volatile boolean running = true;
    private int failedAttempts;
    private String pendingLine;
    private List<Event> pending;

    public IngestionWorker(LineSource source, IEventExtractor extractor, IProgressionEngine engine,
                           Duration pollInterval, int maxAttempts, Duration retryBackoff,
                           MetricsRegistry metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.source = source;
        this.extractor = extractor;
        this.engine = engine;
        this.pollInterval = pollInterval;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.linesRead = metrics.counter("lines_read_total");
    }

    @Override
    public void run() {
        logger.info("Ingestion worker started");
        try {
            while (running) {
                if (!step()) {
                    pause(pollInterval);
                }
            }
        } catch (StoreException e) {
            failure.set(e);
            logger.log(Level.SEVERE, "Ingestion worker stopped: store failed " + maxAttempts + " times in a row", e);
        } catch (RuntimeException e) {
            failure.set(e);
            logger.log(Level.SEVERE, "Ingestion worker crashed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Ingestion worker interrupted");
        } finally {
            running = false;
            logger.info("Ingestion worker stopped");
        }
    }

    /**
     * Processes at most one line.
     *
     * @return {@code true} if a line was consumed or a retry is due, {@code false}
     *         if the source had nothing new
     * @throws StoreException once the same line has failed {@code maxAttempts} times
     * @throws InterruptedException if interrupted during a retry backoff
     */
    boolean step() throws InterruptedException {
        Optional<String> next;
        try {
            next = source.poll();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read log source, retrying", e);
            return false;
        }
        if (next.isEmpty()) {
            return false;
        }

        // the source may have been reset since the failed attempt
        if (pending == null || !next.get().equals(pendingLine)) {
            pendingLine = next.get();
            pending = extractor.parse(pendingLine);
        }
        try {
            for (Event event : pending) {
                engine.apply(event);
            }
        } catch (StoreException e) {
            failedAttempts++;
            if (failedAttempts >= maxAttempts) {
                throw e;
            }
            logger.log(Level.WARNING, String.format("Store failure on attempt %d/%d, retrying line in %d ms",
                    failedAttempts, maxAttempts, retryBackoff.toMillis()), e);
            pause(retryBackoff);
            return true;
        }

        failedAttempts = 0;
        pendingLine = null;
        pending = null;
        source.acknowledge();
        linesRead.increment();
        return true;
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /** The failure that stopped the worker, if any. */
    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(failure.get());
    }

    private static void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
