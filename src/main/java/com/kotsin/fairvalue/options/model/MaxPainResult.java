package com.kotsin.fairvalue.options.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Max pain strike for one expiration: the settlement price at which option
 * holders collectively receive the smallest in-the-money payoff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaxPainResult {

    private double price;
    private LocalDate expiration;
    private int dte;

    // Aggregate payoff (dollars) at the winning strike
    private double totalPainAtMaxPain;
    private double callPain;
    private double putPain;

    // 0-1, OI magnitude + concentration + strike density
    private double confidence;
}
