package com.kotsin.fairvalue.fairvalue.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source tag of a ranked magnetic level.
 */
public enum MagneticLevelType {
    MAX_PAIN("MAX_PAIN"),
    GAMMA_WALL("GAMMA_WALL"),
    PUT_WALL("PUT_WALL"),
    CALL_WALL("CALL_WALL"),
    MA200("MA200"),
    MA50("MA50"),
    MA20("MA20"),
    VWAP("VWAP"),
    FIFTY_TWO_WEEK_HIGH("52W_HIGH"),
    FIFTY_TWO_WEEK_LOW("52W_LOW"),
    SWING_HIGH("SWING_HIGH"),
    SWING_LOW("SWING_LOW"),
    PREV_CLOSE("PREV_CLOSE"),
    ROUND_MAJOR("ROUND_MAJOR"),
    ROUND_MODERATE("ROUND_MODERATE");

    private final String label;

    MagneticLevelType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
