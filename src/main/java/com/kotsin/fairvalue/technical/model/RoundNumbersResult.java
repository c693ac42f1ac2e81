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
public class RoundNumbersResult {

    // Sorted by magnetic pull descending
    @Builder.Default
    private List<RoundNumberLevel> levels = new ArrayList<>();

    private RoundNumberLevel nearestMajor;
    private double magneticCenter;
}
