package com.kotsin.fairvalue.fairvalue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One input of the fair value blend: contribution = value x weight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PFVComponentBreakdown {

    private String name;
    private double value;
    private double weight;
    private double contribution;
}
