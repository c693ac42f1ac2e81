package com.kotsin.fairvalue.fairvalue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Price level from any source, ranked against all others by strength.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MagneticLevel {

    private double price;
    private MagneticLevelType type;

    // 0-1
    private double strength;

    // Signed, percent of current price
    private double distance;

    // Set for options-derived levels only
    private LocalDate expiration;
}
