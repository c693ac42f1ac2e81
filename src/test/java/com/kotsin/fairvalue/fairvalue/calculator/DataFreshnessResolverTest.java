package com.kotsin.fairvalue.fairvalue.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.DataFreshness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataFreshnessResolver")
class DataFreshnessResolverTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            // October: New York is UTC-4
            "2026-10-16T14:00:00Z, FRESH",
            "2026-10-16T13:30:00Z, FRESH",
            "2026-10-16T13:29:59Z, STALE",
            "2026-10-16T20:00:00Z, STALE",
            "2026-10-16T19:59:59Z, FRESH",
            "2026-10-17T15:00:00Z, WEEKEND",
            "2026-10-18T15:00:00Z, WEEKEND",
            // January: New York is UTC-5
            "2026-01-14T14:00:00Z, STALE",
            "2026-01-14T14:30:00Z, FRESH"
    })
    @DisplayName("Session window is evaluated in exchange time")
    void testResolve(String instant, DataFreshness expected) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        DataFreshnessResolver resolver = new DataFreshnessResolver(new FairValueConfig(), clock);

        assertEquals(expected, resolver.resolve());
    }
}
