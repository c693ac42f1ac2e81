package com.kotsin.fairvalue.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TickerProfile {

    private ProfileType type;
    private String name;
    private String description;
    private ProfileWeights weights;

    @Builder.Default
    private List<String> characteristics = new ArrayList<>();
}
