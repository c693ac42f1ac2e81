package com.kotsin.fairvalue.technical.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Technical snapshot for one ticker. Only currentPrice is mandatory;
 * every other field is null when unavailable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalData {

    private Double currentPrice;

    // Moving averages
    private Double ma20;
    private Double ma50;
    private Double ma200;

    // 52-week range
    private Double fiftyTwoWeekHigh;
    private Double fiftyTwoWeekLow;

    // Recent structure
    private Double recentSwingHigh;
    private Double recentSwingLow;
    private Double previousClose;

    // Volume
    private Double vwap;
    private Long avgVolume;
}
