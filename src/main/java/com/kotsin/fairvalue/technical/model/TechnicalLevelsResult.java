package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalLevelsResult {

    // Sorted by absolute distance, closest first
    @Builder.Default
    private List<TechnicalLevel> levels = new ArrayList<>();

    private TechnicalLevel nearestSupport;
    private TechnicalLevel nearestResistance;

    // Strength and proximity weighted, currentPrice when there are no levels
    private double weightedCenter;
}
