package com.kotsin.fairvalue.options.model;

public enum GammaWallType {
    CALL_WALL,
    PUT_WALL,
    COMBINED
}
