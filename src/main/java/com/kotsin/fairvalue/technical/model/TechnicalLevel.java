package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalLevel {

    private double price;
    private TechnicalLevelType type;
    private LevelStrength strength;

    // Signed, percent of current price
    private double distance;

    private boolean isSupport;
    private boolean isResistance;
}
