package com.kotsin.fairvalue.fairvalue.model;

public enum TradeDirection {
    LONG,
    SHORT
}
