package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cluster of two or more technical levels within the confluence threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfluenceZone {

    private PriceZone zone;

    @Builder.Default
    private List<TechnicalLevel> levels = new ArrayList<>();

    private boolean isSupport;

    // Mean level weight, 1 (all WEAK) to 3 (all STRONG)
    private double strength;
}
