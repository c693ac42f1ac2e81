package com.kotsin.fairvalue.fairvalue.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.formatter.FairValueFormatter;
import com.kotsin.fairvalue.fairvalue.model.BiasSentiment;
import com.kotsin.fairvalue.fairvalue.model.ConfidenceLevel;
import com.kotsin.fairvalue.fairvalue.model.FairValueInput;
import com.kotsin.fairvalue.fairvalue.model.FairValueOptions;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevel;
import com.kotsin.fairvalue.fairvalue.model.PFVComponentBreakdown;
import com.kotsin.fairvalue.fairvalue.model.PsychologicalFairValue;
import com.kotsin.fairvalue.fairvalue.model.QuickFairValue;
import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.options.service.MultiExpirationAggregator;
import com.kotsin.fairvalue.profile.ProfileRegistry;
import com.kotsin.fairvalue.profile.model.ProfileWeights;
import com.kotsin.fairvalue.profile.model.TickerProfile;
import com.kotsin.fairvalue.technical.analyzer.RoundNumberAnalyzer;
import com.kotsin.fairvalue.technical.analyzer.TechnicalLevelAnalyzer;
import com.kotsin.fairvalue.technical.model.ConfluenceZone;
import com.kotsin.fairvalue.technical.model.PriceZone;
import com.kotsin.fairvalue.technical.model.RoundNumbersResult;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import com.kotsin.fairvalue.technical.model.TechnicalLevelsResult;
import com.kotsin.fairvalue.util.MathUtils;
import com.kotsin.fairvalue.validator.TechnicalDataValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * FairValueComposer - Fuses options, technical and behavioral signals into one
 * psychological fair value.
 *
 * Flow:
 * 1. Resolve profile, merge weight overrides, normalize
 * 2. Analyze expirations within the DTE window
 * 3. Five components: weighted max pain, weighted gamma center, technical center,
 *    volume anchor (VWAP, else technical center), round-number center
 * 4. Fair value = sum(component x weight)
 * 5. Deviation, bias, confidence
 * 6. Ranked magnetic levels, support/resistance zones, freshness and text summaries
 *
 * Pure function of its input apart from calculatedAt and dataFreshness.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FairValueComposer {

    private static final String LOG_PREFIX = "[PFV]";

    static final String MAX_PAIN = "Max Pain";
    static final String GAMMA_WALLS = "Gamma Walls";
    static final String TECHNICAL_LEVELS = "Technical Levels";
    static final String VOLUME_ANCHOR = "Volume Anchor";
    static final String ROUND_NUMBERS = "Round Numbers";

    // quickFairValue blend
    private static final double QUICK_MA200_WEIGHT = 0.3;
    private static final double QUICK_MAX_PAIN_WEIGHT = 0.4;

    private final FairValueConfig config;
    private final ProfileRegistry profileRegistry;
    private final MultiExpirationAggregator aggregator;
    private final TechnicalLevelAnalyzer technicalLevelAnalyzer;
    private final RoundNumberAnalyzer roundNumberAnalyzer;
    private final MagneticLevelCollector magneticLevelCollector;
    private final DataFreshnessResolver freshnessResolver;
    private final FairValueFormatter formatter;
    private final Clock clock;

    public PsychologicalFairValue calculatePsychologicalFairValue(FairValueInput input) {
        return calculatePsychologicalFairValue(input, FairValueOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException when the input has no usable price anchor
     */
    public PsychologicalFairValue calculatePsychologicalFairValue(FairValueInput input, FairValueOptions options) {
        TechnicalDataValidator.validate(input);
        FairValueOptions opts = options != null ? options : FairValueOptions.defaults();
        FairValueConfig.Composer cfg = config.getComposer();

        String ticker = input.getTicker().trim().toUpperCase(Locale.ROOT);
        TechnicalData technicalData = input.getTechnicalData();
        double currentPrice = technicalData.getCurrentPrice();

        // 1. Profile
        TickerProfile baseProfile = input.getProfileOverride() != null
                ? profileRegistry.getProfile(input.getProfileOverride())
                : profileRegistry.resolveProfile(ticker, technicalData, input.getExpirations());
        TickerProfile profile = profileRegistry.applyOverrides(baseProfile, opts.getCustomWeights());
        ProfileWeights weights = profile.getWeights();

        // 2. Expirations
        int minDte = opts.getMinDte() != null ? opts.getMinDte() : config.getExpiration().getMinDte();
        int maxDte = opts.getMaxDte() != null ? opts.getMaxDte() : config.getExpiration().getMaxDte();
        List<ExpirationAnalysis> analyses = aggregator.analyzeMultipleExpirations(
                input.getExpirations(), currentPrice, maxDte, minDte);

        // 3. Components
        double weightedMaxPain = aggregator.getWeightedMaxPain(analyses, currentPrice);
        double weightedGammaCenter = aggregator.getWeightedGammaCenter(analyses, currentPrice);
        TechnicalLevelsResult technical = technicalLevelAnalyzer.analyzeTechnicalLevels(technicalData);
        RoundNumbersResult roundNumbers = roundNumberAnalyzer.analyzeRoundNumbers(currentPrice);
        double volumeAnchor = MathUtils.isValidPositive(technicalData.getVwap())
                ? technicalData.getVwap()
                : technical.getWeightedCenter();

        List<PFVComponentBreakdown> components = List.of(
                component(MAX_PAIN, weightedMaxPain, weights.getMaxPain()),
                component(GAMMA_WALLS, weightedGammaCenter, weights.getGammaWalls()),
                component(TECHNICAL_LEVELS, technical.getWeightedCenter(), weights.getTechnical()),
                component(VOLUME_ANCHOR, volumeAnchor, weights.getVolume()),
                component(ROUND_NUMBERS, roundNumbers.getMagneticCenter(), weights.getRoundNumber()));

        // 4. Fair value
        double fairValue = components.stream().mapToDouble(PFVComponentBreakdown::getContribution).sum();

        // 5. Deviation, bias, confidence
        double deviationDollars = fairValue - currentPrice;
        double deviationPercent = deviationDollars / currentPrice * 100;
        BiasSentiment bias = determineBias(deviationPercent, technicalData);

        boolean hasEvidence = !analyses.isEmpty() || !technical.getLevels().isEmpty();
        double confidenceScore = calculateConfidenceScore(components, fairValue, currentPrice, analyses);
        ConfidenceLevel confidence = hasEvidence ? gradeConfidence(confidenceScore) : ConfidenceLevel.LOW;

        // 6. Levels and zones
        boolean includeAll = opts.isIncludeAllLevels();
        int maxLevels = opts.getMaxMagneticLevels() != null ? opts.getMaxMagneticLevels() : cfg.getMaxMagneticLevels();
        List<MagneticLevel> magneticLevels = magneticLevelCollector.collect(
                analyses, technical.getLevels(), roundNumbers.getLevels(), currentPrice, includeAll, maxLevels);

        List<ConfluenceZone> zones = technicalLevelAnalyzer.findConfluenceZones(technical.getLevels(), currentPrice);
        PriceZone supportZone = zones.stream().filter(ConfluenceZone::isSupport).findFirst()
                .map(z -> roundZone(z.getZone())).orElse(null);
        PriceZone resistanceZone = zones.stream().filter(z -> !z.isSupport()).findFirst()
                .map(z -> roundZone(z.getZone())).orElse(null);

        PsychologicalFairValue result = PsychologicalFairValue.builder()
                .ticker(ticker)
                .fairValue(MathUtils.roundPrice(fairValue))
                .currentPrice(currentPrice)
                .confidence(confidence)
                .confidenceScore(MathUtils.round(confidenceScore, 4))
                .deviationPercent(MathUtils.roundPercent(deviationPercent))
                .deviationDollars(MathUtils.roundPrice(deviationDollars))
                .bias(bias)
                .profile(profile)
                .components(components)
                .expirationAnalysis(analyses)
                .primaryExpiration(aggregator.getPrimaryExpiration(analyses).orElse(null))
                .magneticLevels(magneticLevels)
                .supportZone(supportZone)
                .resistanceZone(resistanceZone)
                .calculatedAt(clock.instant())
                .dataFreshness(freshnessResolver.resolve())
                .build();

        result.setAiContext(formatter.aiContext(result));
        result.setInterpretation(formatter.interpretation(result));

        log.info("{} {}: fair={} current={} dev={}% bias={} confidence={} profile={} expirations={} levels={}",
                LOG_PREFIX, ticker, String.format("%.2f", fairValue), currentPrice,
                String.format("%.1f", deviationPercent), bias, confidence, profile.getType(),
                analyses.size(), magneticLevels.size());

        return result;
    }

    /**
     * Light estimate without options chains: price weight 1, MA200 0.3, nearest max pain 0.4.
     */
    public QuickFairValue quickFairValue(double currentPrice, Double ma200, Double nearestMaxPain) {
        double sum = currentPrice;
        double weight = 1.0;
        if (MathUtils.isValidPositive(ma200)) {
            sum += ma200 * QUICK_MA200_WEIGHT;
            weight += QUICK_MA200_WEIGHT;
        }
        if (MathUtils.isValidPositive(nearestMaxPain)) {
            sum += nearestMaxPain * QUICK_MAX_PAIN_WEIGHT;
            weight += QUICK_MAX_PAIN_WEIGHT;
        }
        double fairValue = sum / weight;
        double deviationPercent = MathUtils.safePercentageChange(fairValue, currentPrice, 0.0);
        return QuickFairValue.builder()
                .fairValue(fairValue)
                .bias(biasFromDeviation(deviationPercent, BiasSentiment.NEUTRAL))
                .build();
    }

    private BiasSentiment determineBias(double deviationPercent, TechnicalData technicalData) {
        BiasSentiment fromDeviation = biasFromDeviation(deviationPercent, null);
        if (fromDeviation != null) {
            return fromDeviation;
        }
        return technicalLevelAnalyzer.determineTrendBias(technicalData);
    }

    private BiasSentiment biasFromDeviation(double deviationPercent, BiasSentiment otherwise) {
        double threshold = config.getComposer().getBiasThresholdPercent();
        if (deviationPercent > threshold) return BiasSentiment.BULLISH;
        if (deviationPercent < -threshold) return BiasSentiment.BEARISH;
        return otherwise;
    }

    /**
     * 0.4 x convergence + 0.4 x options quality + 0.2 x distance factor, clamped to [0, 1].
     */
    double calculateConfidenceScore(List<PFVComponentBreakdown> components, double fairValue,
                                    double currentPrice, List<ExpirationAnalysis> analyses) {
        FairValueConfig.Composer cfg = config.getComposer();

        double[] values = components.stream().mapToDouble(PFVComponentBreakdown::getValue).toArray();
        double convergence = Math.max(0, 1 - cfg.getConvergenceScale() * MathUtils.coefficientOfVariation(values));

        double optionsQuality = cfg.getNoOptionsQuality();
        if (!analyses.isEmpty()) {
            double meanConfidence = analyses.stream().mapToDouble(a -> a.getMaxPain().getConfidence()).average().orElse(0);
            optionsQuality = Math.min(1.0, meanConfidence);
        }

        double distanceFraction = Math.abs(fairValue - currentPrice) / currentPrice;
        double distanceFactor = Math.max(cfg.getDistanceFloor(), 1 - cfg.getDistanceScale() * distanceFraction);

        double score = cfg.getConvergenceWeight() * convergence
                + cfg.getOptionsQualityWeight() * optionsQuality
                + cfg.getDistanceWeight() * distanceFactor;

        log.debug("{} confidence: convergence={}, optionsQuality={}, distance={}, score={}", LOG_PREFIX,
                String.format("%.3f", convergence), String.format("%.3f", optionsQuality),
                String.format("%.3f", distanceFactor), String.format("%.3f", score));
        return MathUtils.clampUnit(score);
    }

    private ConfidenceLevel gradeConfidence(double score) {
        FairValueConfig.Composer cfg = config.getComposer();
        if (score >= cfg.getHighThreshold()) return ConfidenceLevel.HIGH;
        if (score >= cfg.getMediumThreshold()) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    private static PFVComponentBreakdown component(String name, double value, double weight) {
        return PFVComponentBreakdown.builder()
                .name(name)
                .value(value)
                .weight(weight)
                .contribution(value * weight)
                .build();
    }

    private static PriceZone roundZone(PriceZone zone) {
        return PriceZone.builder()
                .low(MathUtils.roundPrice(zone.getLow()))
                .high(MathUtils.roundPrice(zone.getHigh()))
                .build();
    }
}
