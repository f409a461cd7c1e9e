package com.raidxp.extractor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    private static final Instant NOW = Instant.parse("2024-06-15T23:30:00Z");

    // Non-UTC zone on the clock must not shift the date used for time-only values
    private final TimestampParser parser = new TimestampParser(Clock.fixed(NOW, ZoneId.of("Asia/Tokyo")));

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-01-01T00:00:00",
            "2024-01-01 00:00:00",
            "2024-01-01 00:00:00 UTC",
            "2024-01-01T00:00:00Z",
            " 2024-01-01T00:00:00.000 "
    })
    void parsesDateTimeFormats(String raw) {
        assertThat(parser.parse(raw)).contains(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void timeOnlyUsesCurrentUtcDate() {
        assertThat(parser.parse("08:15:00")).contains(Instant.parse("2024-06-15T08:15:00Z"));
    }

    @Test
    void unknownFormatsAreEmpty() {
        assertThat(parser.parse("01/02/2024 10:00")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void parseOrNowFallsBackToClock() {
        assertThat(parser.parseOrNow("not a time")).isEqualTo(NOW);
        assertThat(parser.parseOrNow("2024-01-01 00:00:00")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }
}
