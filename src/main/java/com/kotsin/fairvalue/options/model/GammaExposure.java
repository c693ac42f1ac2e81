package com.kotsin.fairvalue.options.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated dealer gamma exposure at one strike.
 * Calls contribute positive GEX, puts negative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GammaExposure {

    private double strike;
    private double callGex;
    private double putGex;
    private double netGex;
}
