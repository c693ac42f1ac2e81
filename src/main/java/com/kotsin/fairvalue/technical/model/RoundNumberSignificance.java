package com.kotsin.fairvalue.technical.model;

public enum RoundNumberSignificance {
    MAJOR(1.0, 3),
    MODERATE(0.6, 2),
    MINOR(0.3, 1);

    private final double baseWeight;
    private final int rank;

    RoundNumberSignificance(double baseWeight, int rank) {
        this.baseWeight = baseWeight;
        this.rank = rank;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    public int getRank() {
        return rank;
    }
}
