package com.kotsin.fairvalue.fairvalue.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.DataFreshness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Tags a calculation with whether it ran during regular exchange hours.
 * WEEKEND on Saturday/Sunday, STALE outside [marketOpen, marketClose), FRESH otherwise.
 * Exchange holidays are not modelled.
 */
@Slf4j
@Component
public class DataFreshnessResolver {

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime marketOpen;
    private final LocalTime marketClose;

    public DataFreshnessResolver(FairValueConfig config, Clock clock) {
        FairValueConfig.Freshness cfg = config.getFreshness();
        this.clock = clock;
        this.zone = ZoneId.of(cfg.getZone());
        this.marketOpen = LocalTime.parse(cfg.getMarketOpen());
        this.marketClose = LocalTime.parse(cfg.getMarketClose());
        log.debug("[FRESHNESS] zone={}, session=[{}, {})", zone, marketOpen, marketClose);
    }

    public DataFreshness resolve() {
        return resolve(clock.instant());
    }

    public DataFreshness resolve(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return DataFreshness.WEEKEND;
        }
        LocalTime time = local.toLocalTime();
        if (time.isBefore(marketOpen) || !time.isBefore(marketClose)) {
            return DataFreshness.STALE;
        }
        return DataFreshness.FRESH;
    }
}
