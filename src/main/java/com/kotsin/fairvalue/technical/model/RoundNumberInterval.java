package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Spacing of one round-number tier for a price range.
 */
@Data
@AllArgsConstructor
public class RoundNumberInterval {

    private double interval;
    private RoundNumberSignificance significance;
}
