package com.kotsin.fairvalue.data;

import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.technical.model.TechnicalData;

import java.util.List;
import java.util.Optional;

/**
 * Source of market snapshots for provider-backed lookups.
 *
 * No implementation ships with the engine; register a bean to enable
 * {@code GET /api/fair-value/{ticker}}. Implementations may throw on transport
 * failures, callers treat that as "no data".
 */
public interface MarketDataProvider {

    Optional<TechnicalData> fetchTechnicalData(String ticker);

    /**
     * Nearest expirations first, at most maxExpirations of them.
     */
    List<OptionsExpiration> fetchExpirations(String ticker, int maxExpirations);
}
