package com.kotsin.fairvalue.technical.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceZone {

    private double low;
    private double high;

    @JsonIgnore
    public double getMidpoint() {
        return (low + high) / 2;
    }
}
