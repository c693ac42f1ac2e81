package com.kotsin.fairvalue.fairvalue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuickFairValue {

    private double fairValue;
    private BiasSentiment bias;
}
