package com.kotsin.fairvalue.options.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single option contract snapshot for one strike.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionContract {

    private double strike;
    private long openInterest;
    private long volume;

    // Optional greeks / IV, null when the feed does not supply them
    private Double impliedVolatility;
    private Double delta;
    private Double gamma;
}
