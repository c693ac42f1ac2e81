package com.kotsin.fairvalue.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial weight overrides. A null field keeps the profile's weight.
 * Values need not sum to 1.0; the merged bundle is renormalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightOverrides {

    private Double maxPain;
    private Double gammaWalls;
    private Double technical;
    private Double volume;
    private Double roundNumber;

    public boolean isEmpty() {
        return maxPain == null && gammaWalls == null && technical == null
                && volume == null && roundNumber == null;
    }
}
