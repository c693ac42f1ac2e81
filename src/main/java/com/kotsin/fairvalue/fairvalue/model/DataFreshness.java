package com.kotsin.fairvalue.fairvalue.model;

/**
 * Whether the inputs were likely captured during regular trading hours.
 */
public enum DataFreshness {
    FRESH,
    STALE,
    WEEKEND
}
