package com.kotsin.fairvalue.fairvalue.model;

import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.profile.model.TickerProfile;
import com.kotsin.fairvalue.technical.model.PriceZone;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Psychological fair value for one ticker: the price the market is pulled toward by
 * options positioning, technical levels and round-number bias.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PsychologicalFairValue {

    private String ticker;
    private double fairValue;
    private double currentPrice;

    private ConfidenceLevel confidence;
    // Raw blend behind the confidence grade, 0-1
    private double confidenceScore;

    private double deviationPercent;
    private double deviationDollars;
    private BiasSentiment bias;

    private TickerProfile profile;

    @Builder.Default
    private List<PFVComponentBreakdown> components = new ArrayList<>();

    @Builder.Default
    private List<ExpirationAnalysis> expirationAnalysis = new ArrayList<>();
    private ExpirationAnalysis primaryExpiration;

    @Builder.Default
    private List<MagneticLevel> magneticLevels = new ArrayList<>();

    private PriceZone supportZone;
    private PriceZone resistanceZone;

    private Instant calculatedAt;
    private DataFreshness dataFreshness;

    private String aiContext;
    private String interpretation;
}
