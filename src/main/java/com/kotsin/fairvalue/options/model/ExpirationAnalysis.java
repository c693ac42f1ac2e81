package com.kotsin.fairvalue.options.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Options signals for one expiration plus its share of the multi-expiration blend.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExpirationAnalysis {

    private LocalDate expiration;
    private int dte;
    private MaxPainResult maxPain;
    private GammaWallsResult gammaWalls;

    // Normalized; weights across one analysis set sum to 1.0
    private double weight;

    private boolean isMonthlyOpex;
    private boolean isWeeklyOpex;
}
