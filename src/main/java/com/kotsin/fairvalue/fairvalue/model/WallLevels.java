package com.kotsin.fairvalue.fairvalue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wall prices for spread construction: put walls as short-put candidates,
 * call and combined walls as short-call candidates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WallLevels {

    @Builder.Default
    private List<Double> putWalls = new ArrayList<>();

    @Builder.Default
    private List<Double> callWalls = new ArrayList<>();
}
