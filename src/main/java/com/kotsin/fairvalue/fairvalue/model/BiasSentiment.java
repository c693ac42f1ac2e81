package com.kotsin.fairvalue.fairvalue.model;

public enum BiasSentiment {
    BULLISH,
    NEUTRAL,
    BEARISH
}
