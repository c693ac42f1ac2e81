package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundNumberLevel {

    private double price;
    private RoundNumberSignificance significance;

    // Signed, percent of current price
    private double distance;

    // 0-1
    private double magneticPull;
}
