package com.kotsin.fairvalue.profile;

import com.kotsin.fairvalue.profile.model.ProfileType;

import java.util.Optional;

/**
 * Classifies a ticker symbol into a known profile.
 *
 * Implementations should be case-insensitive and return empty for unknown symbols,
 * letting the registry fall through to data heuristics.
 */
public interface TickerClassificationProvider {

    /**
     * @param ticker symbol, any case
     * @return the known profile type, or empty if the symbol is not classified
     */
    Optional<ProfileType> classify(String ticker);
}
