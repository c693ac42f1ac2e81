package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A headline level traders watch (52-week extremes, MA200) with its distance from price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    private String name;
    private double price;

    // Signed, percent of current price
    private double distance;

    private Direction direction;

    public enum Direction {
        UP,
        DOWN
    }
}
