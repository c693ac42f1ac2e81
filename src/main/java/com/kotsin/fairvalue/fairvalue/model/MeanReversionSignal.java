package com.kotsin.fairvalue.fairvalue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reversion trade hint derived from the fair value deviation.
 * direction is null and strength 0 when there is no signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeanReversionSignal {

    private boolean signal;
    private TradeDirection direction;

    // 0-100, 10 points per percent of deviation
    private double strength;

    public static MeanReversionSignal none() {
        return new MeanReversionSignal(false, null, 0.0);
    }
}
