package com.kotsin.fairvalue.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Component weights for the fair value blend (Total: 1.0 after normalization).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProfileWeights {

    private double maxPain;
    private double gammaWalls;
    private double technical;
    private double volume;
    private double roundNumber;

    public double getTotal() {
        return maxPain + gammaWalls + technical + volume + roundNumber;
    }

    public static ProfileWeights equal() {
        return new ProfileWeights(0.2, 0.2, 0.2, 0.2, 0.2);
    }
}
