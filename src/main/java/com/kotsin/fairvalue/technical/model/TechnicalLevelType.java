package com.kotsin.fairvalue.technical.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source of a technical price level.
 */
public enum TechnicalLevelType {
    MA20("MA20"),
    MA50("MA50"),
    MA200("MA200"),
    FIFTY_TWO_WEEK_HIGH("52W_HIGH"),
    FIFTY_TWO_WEEK_LOW("52W_LOW"),
    SWING_HIGH("SWING_HIGH"),
    SWING_LOW("SWING_LOW"),
    VWAP("VWAP"),
    PREV_CLOSE("PREV_CLOSE");

    private final String label;

    TechnicalLevelType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
