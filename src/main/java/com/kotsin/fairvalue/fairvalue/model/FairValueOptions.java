package com.kotsin.fairvalue.fairvalue.model;

import com.kotsin.fairvalue.profile.model.WeightOverrides;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call knobs. Null fields fall back to pfv.* configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FairValueOptions {

    private Integer minDte;
    private Integer maxDte;
    private WeightOverrides customWeights;
    private boolean includeAllLevels;
    private Integer maxMagneticLevels;

    public static FairValueOptions defaults() {
        return new FairValueOptions();
    }

    /**
     * Detached copy, including the weight overrides.
     */
    public FairValueOptions copy() {
        WeightOverrides weights = customWeights == null ? null : WeightOverrides.builder()
                .maxPain(customWeights.getMaxPain())
                .gammaWalls(customWeights.getGammaWalls())
                .technical(customWeights.getTechnical())
                .volume(customWeights.getVolume())
                .roundNumber(customWeights.getRoundNumber())
                .build();
        return new FairValueOptions(minDte, maxDte, weights, includeAllLevels, maxMagneticLevels);
    }
}
