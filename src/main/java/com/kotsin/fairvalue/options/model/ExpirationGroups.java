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
public class ExpirationGroups {

    @Builder.Default
    private List<ExpirationAnalysis> monthly = new ArrayList<>();

    @Builder.Default
    private List<ExpirationAnalysis> weekly = new ArrayList<>();

    @Builder.Default
    private List<ExpirationAnalysis> other = new ArrayList<>();
}
