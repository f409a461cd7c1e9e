package com.raidxp.service.ingestion;

import com.raidxp.api.IEventExtractor;
import com.raidxp.api.IProgressionEngine;
import com.raidxp.api.exceptions.StoreException;
import com.raidxp.api.model.Event;
import com.raidxp.api.model.EventTypes;
import com.raidxp.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionWorkerTest {

    private static final String LINE = "[2024-01-01 00:00:00] Ann killed Bob HEADSHOT";
    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");
    private static final Event KILL = new Event(TS, EventTypes.KILL, "Ann", Map.of("victim", "Bob"));
    private static final Event HEADSHOT = new Event(TS, EventTypes.HEADSHOT, "Ann", Map.of("victim", "Bob"));

    @Mock
    private LineSource source;

    @Mock
    private IEventExtractor extractor;

    @Mock
    private IProgressionEngine engine;

    private InMemoryMetricsRegistry metrics;
    private IngestionWorker worker;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        worker = new IngestionWorker(source, extractor, engine, Duration.ZERO, 3, Duration.ZERO, metrics);
    }

    @Test
    void appliesEveryEventThenAdvances() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE));
        when(extractor.parse(LINE)).thenReturn(List.of(KILL, HEADSHOT));

        assertThat(worker.step()).isTrue();

        InOrder order = inOrder(engine, source);
        order.verify(engine).apply(KILL);
        order.verify(engine).apply(HEADSHOT);
        order.verify(source).acknowledge();
        assertThat(metrics.getCounterValue("lines_read_total")).isEqualTo(1L);
    }

    @Test
    void advancesPastLinesWithoutEvents() throws Exception {
        when(source.poll()).thenReturn(Optional.of("noise"));
        when(extractor.parse("noise")).thenReturn(List.of());

        assertThat(worker.step()).isTrue();

        verify(source).acknowledge();
        verify(engine, never()).apply(any());
    }

    @Test
    void idleWhenSourceHasNothing() throws Exception {
        when(source.poll()).thenReturn(Optional.empty());

        assertThat(worker.step()).isFalse();

        verify(source, never()).acknowledge();
    }

    @Test
    void sourceReadFailureIsNotFatal() throws Exception {
        when(source.poll()).thenThrow(new IOException("stale handle"));

        assertThat(worker.step()).isFalse();
    }

    @Test
    @DisplayName("A store failure leaves the cursor on the line and retries it")
    void retriesWithoutAdvancing() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE));
        when(extractor.parse(LINE)).thenReturn(List.of(KILL));
        when(engine.apply(KILL))
                .thenThrow(new StoreException("connection reset"))
                .thenReturn(true);

        assertThat(worker.step()).isTrue();
        verify(source, never()).acknowledge();

        assertThat(worker.step()).isTrue();
        verify(source, times(2)).poll();
        verify(source).acknowledge();
        assertThat(metrics.getCounterValue("lines_read_total")).isEqualTo(1L);
    }

    @Test
    @DisplayName("A retry applies the events parsed on the first attempt")
    void retryDoesNotReparseTheLine() throws Exception {
        String line = "EXTRACT: Ann";
        Event first = new Event(TS, EventTypes.EXTRACT, "Ann");
        Event survive = new Event(TS, EventTypes.SURVIVE, "Ann", Map.of("from", EventTypes.EXTRACT));
        when(source.poll()).thenReturn(Optional.of(line));
        when(extractor.parse(line)).thenReturn(List.of(first, survive));
        when(engine.apply(first)).thenReturn(true).thenReturn(false);
        when(engine.apply(survive))
                .thenThrow(new StoreException("connection reset"))
                .thenReturn(true);

        assertThat(worker.step()).isTrue();
        assertThat(worker.step()).isTrue();

        verify(extractor, times(1)).parse(line);
        verify(engine, times(2)).apply(first);
        verify(source).acknowledge();
    }

    @Test
    void changedLineAfterFailureIsParsedAgain() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE), Optional.of("noise"));
        when(extractor.parse(LINE)).thenReturn(List.of(KILL));
        when(extractor.parse("noise")).thenReturn(List.of());
        when(engine.apply(KILL)).thenThrow(new StoreException("connection reset"));

        assertThat(worker.step()).isTrue();
        assertThat(worker.step()).isTrue();

        verify(extractor).parse("noise");
        verify(source).acknowledge();
    }

    @Test
    void failsAfterMaxAttempts() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE));
        when(extractor.parse(LINE)).thenReturn(List.of(KILL));
        when(engine.apply(KILL)).thenThrow(new StoreException("database is down"));

        assertThat(worker.step()).isTrue();
        assertThat(worker.step()).isTrue();
        assertThatThrownBy(() -> worker.step())
                .isInstanceOf(StoreException.class)
                .hasMessage("database is down");

        verify(source, never()).acknowledge();
    }

    @Test
    void runStopsOnFatalStoreFailure() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE));
        when(extractor.parse(LINE)).thenReturn(List.of(KILL));
        when(engine.apply(KILL)).thenThrow(new StoreException("database is down"));

        worker.run();

        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.failure()).hasValueSatisfying(e -> assertThat(e).hasMessage("database is down"));
        verify(engine, times(3)).apply(KILL);
    }

    @Test
    void runRecordsUnexpectedFailures() throws Exception {
        when(source.poll()).thenReturn(Optional.of(LINE));
        when(extractor.parse(LINE)).thenThrow(new IllegalStateException("rule state corrupted"));

        worker.run();

        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.failure()).hasValueSatisfying(e -> assertThat(e)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("rule state corrupted"));
        verify(source, never()).acknowledge();
    }

    @Test
    void stoppedWorkerReadsNothing() throws Exception {
        worker.stop();

        worker.run();

        verify(source, never()).poll();
        assertThat(worker.failure()).isEmpty();
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new IngestionWorker(source, extractor, engine,
                Duration.ZERO, 0, Duration.ZERO, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
