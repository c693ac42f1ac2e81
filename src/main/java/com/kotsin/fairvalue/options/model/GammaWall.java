package com.kotsin.fairvalue.options.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Strike with abnormally high open interest relative to the chain median.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GammaWall {

    private double strike;
    private GammaWallType type;
    private long openInterest;
    private long volume;

    // OI / median OI of the same side
    private double relativeStrength;

    private boolean isSupport;
    private boolean isResistance;
}
