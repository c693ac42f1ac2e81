package com.kotsin.fairvalue.technical.model;

/**
 * How strongly the market respects a technical level.
 * weight feeds the technical center and zone scores, magneticStrength the ranked level list.
 */
public enum LevelStrength {
    WEAK(1, 0.3),
    MODERATE(2, 0.6),
    STRONG(3, 0.9);

    private final int weight;
    private final double magneticStrength;

    LevelStrength(int weight, double magneticStrength) {
        this.weight = weight;
        this.magneticStrength = magneticStrength;
    }

    public int getWeight() {
        return weight;
    }

    public double getMagneticStrength() {
        return magneticStrength;
    }
}
