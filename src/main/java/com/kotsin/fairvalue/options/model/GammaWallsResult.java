package com.kotsin.fairvalue.options.model;

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
public class GammaWallsResult {

    // Sorted by relativeStrength descending
    @Builder.Default
    private List<GammaWall> walls = new ArrayList<>();

    private GammaWall strongestSupport;
    private GammaWall strongestResistance;

    // OI x strength weighted strike, currentPrice when there are no walls
    private double center;
}
