package com.kotsin.fairvalue.profile.model;

/**
 * Behavioral profile of a ticker. Each type carries a different hypothesis about
 * which forces pull price: options pinning, hedging flows, technicals, volume or round numbers.
 */
public enum ProfileType {
    BLUE_CHIP,
    MEME_RETAIL,
    ETF,
    LOW_FLOAT,
    DEFAULT
}
