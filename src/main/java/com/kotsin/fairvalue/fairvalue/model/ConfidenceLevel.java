package com.kotsin.fairvalue.fairvalue.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
