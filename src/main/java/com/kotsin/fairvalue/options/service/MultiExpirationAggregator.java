package com.kotsin.fairvalue.options.service;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.options.calculator.GammaWallDetector;
import com.kotsin.fairvalue.options.calculator.MaxPainCalculator;
import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.options.model.ExpirationGroups;
import com.kotsin.fairvalue.options.model.GammaWall;
import com.kotsin.fairvalue.options.model.GammaWallType;
import com.kotsin.fairvalue.options.model.GammaWallsResult;
import com.kotsin.fairvalue.options.model.MaxPainResult;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.util.MathUtils;
import com.kotsin.fairvalue.util.OpexCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * MultiExpirationAggregator - Blends max pain and gamma walls across expirations.
 *
 * Weight per expiration:
 *   exp(-dte / 30) x sqrt(totalOI / maxTotalOI) x opexMultiplier x (0.5 + 0.5 x maxPainConfidence)
 * where opexMultiplier is 1.5 for monthly OPEX, 1.2 for weekly, 1.0 otherwise.
 * Weights are normalized to 1.0 (equal weights if every raw weight is 0) and the
 * analyses are returned heaviest first, so index 0 is the primary expiration.
 *
 * Per-expiration analysis is independent; with pfv.expiration.parallel it fans out
 * on the expiration executor and produces the same result as the sequential path.
 */
@Service
@Slf4j
public class MultiExpirationAggregator {

    private static final String LOG_PREFIX = "[MULTI-EXPIRY]";

    private final FairValueConfig config;
    private final MaxPainCalculator maxPainCalculator;
    private final GammaWallDetector gammaWallDetector;
    private final Executor executor;

    public MultiExpirationAggregator(FairValueConfig config,
                                     MaxPainCalculator maxPainCalculator,
                                     GammaWallDetector gammaWallDetector,
                                     @Qualifier("expirationAnalysisExecutor") Executor executor) {
        this.config = config;
        this.maxPainCalculator = maxPainCalculator;
        this.gammaWallDetector = gammaWallDetector;
        this.executor = executor;
    }

    public List<ExpirationAnalysis> analyzeMultipleExpirations(List<OptionsExpiration> expirations, double currentPrice) {
        return analyzeMultipleExpirations(expirations, currentPrice,
                config.getExpiration().getMaxDte(), config.getExpiration().getMinDte());
    }

    /**
     * Analyze every expiration with minDte &lt;= dte &lt;= maxDte.
     *
     * @return analyses sorted by weight descending; empty when nothing survives the DTE filter
     */
    public List<ExpirationAnalysis> analyzeMultipleExpirations(List<OptionsExpiration> expirations,
                                                               double currentPrice, int maxDte, int minDte) {
        if (expirations == null || expirations.isEmpty()) {
            return new ArrayList<>();
        }

        List<OptionsExpiration> filtered = expirations.stream()
                .filter(e -> e != null && e.getDte() >= minDte && e.getDte() <= maxDte)
                .collect(Collectors.toList());

        if (filtered.isEmpty()) {
            log.debug("{} No expirations within dte [{}, {}] out of {}", LOG_PREFIX, minDte, maxDte, expirations.size());
            return new ArrayList<>();
        }

        List<ExpirationAnalysis> analyses = analyzeEach(filtered, currentPrice);
        double[] weights = calculateWeights(analyses, filtered);

        List<ExpirationAnalysis> weighted = new ArrayList<>(analyses.size());
        for (int i = 0; i < analyses.size(); i++) {
            weighted.add(analyses.get(i).toBuilder().weight(weights[i]).build());
        }

        weighted.sort(Comparator.comparingDouble(ExpirationAnalysis::getWeight).reversed());

        log.debug("{} Analyzed {} expirations, primary={} (weight={})", LOG_PREFIX, weighted.size(),
                weighted.get(0).getExpiration(), String.format("%.3f", weighted.get(0).getWeight()));
        return weighted;
    }

    private List<ExpirationAnalysis> analyzeEach(List<OptionsExpiration> expirations, double currentPrice) {
        if (!config.getExpiration().isParallel() || expirations.size() < 2 || executor == null) {
            return expirations.stream()
                    .map(e -> analyzeOne(e, currentPrice))
                    .collect(Collectors.toList());
        }

        List<CompletableFuture<ExpirationAnalysis>> futures = expirations.stream()
                .map(e -> CompletableFuture.supplyAsync(() -> analyzeOne(e, currentPrice), executor))
                .collect(Collectors.toList());

        // join() keeps input order regardless of completion order
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private ExpirationAnalysis analyzeOne(OptionsExpiration expiration, double currentPrice) {
        MaxPainResult maxPain = maxPainCalculator.calculateMaxPain(expiration, currentPrice);
        GammaWallsResult gammaWalls = gammaWallDetector.detectGammaWalls(expiration, currentPrice);
        return ExpirationAnalysis.builder()
                .expiration(expiration.getExpiration())
                .dte(expiration.getDte())
                .maxPain(maxPain)
                .gammaWalls(gammaWalls)
                .weight(0)
                .isMonthlyOpex(OpexCalendar.isMonthlyOpex(expiration.getExpiration()))
                .isWeeklyOpex(OpexCalendar.isWeeklyOpex(expiration.getExpiration()))
                .build();
    }

    private double[] calculateWeights(List<ExpirationAnalysis> analyses, List<OptionsExpiration> expirations) {
        FairValueConfig.Expiration cfg = config.getExpiration();

        long maxOI = 0;
        for (OptionsExpiration e : expirations) {
            maxOI = Math.max(maxOI, e.getTotalOI());
        }

        double[] weights = new double[analyses.size()];
        double total = 0;
        for (int i = 0; i < analyses.size(); i++) {
            ExpirationAnalysis analysis = analyses.get(i);

            double timeWeight = Math.exp(-analysis.getDte() / cfg.getTimeDecayDays());
            double oiWeight = maxOI > 0 ? Math.sqrt((double) expirations.get(i).getTotalOI() / maxOI) : 0.5;

            double opexMultiplier = 1.0;
            if (analysis.isMonthlyOpex()) {
                opexMultiplier = cfg.getMonthlyOpexMultiplier();
            } else if (analysis.isWeeklyOpex()) {
                opexMultiplier = cfg.getWeeklyOpexMultiplier();
            }

            double confidenceWeight = 0.5 + analysis.getMaxPain().getConfidence() * 0.5;

            weights[i] = timeWeight * oiWeight * opexMultiplier * confidenceWeight;
            total += weights[i];
        }

        for (int i = 0; i < weights.length; i++) {
            weights[i] = total > 0 ? weights[i] / total : 1.0 / weights.length;
        }
        return weights;
    }

    // ======================== WEIGHTED COMPONENTS ========================

    /**
     * Weighted max pain across the analyses, fallback when there are none.
     */
    public double getWeightedMaxPain(List<ExpirationAnalysis> analyses, double fallback) {
        if (analyses == null || analyses.isEmpty()) {
            return fallback;
        }
        double[] prices = analyses.stream().mapToDouble(a -> a.getMaxPain().getPrice()).toArray();
        double[] weights = analyses.stream().mapToDouble(ExpirationAnalysis::getWeight).toArray();
        return MathUtils.weightedAverage(prices, weights, fallback);
    }

    /**
     * Weighted gamma center across the analyses, fallback when there are none.
     */
    public double getWeightedGammaCenter(List<ExpirationAnalysis> analyses, double fallback) {
        if (analyses == null || analyses.isEmpty()) {
            return fallback;
        }
        double[] centers = analyses.stream().mapToDouble(a -> a.getGammaWalls().getCenter()).toArray();
        double[] weights = analyses.stream().mapToDouble(ExpirationAnalysis::getWeight).toArray();
        return MathUtils.weightedAverage(centers, weights, fallback);
    }

    public Optional<ExpirationAnalysis> getPrimaryExpiration(List<ExpirationAnalysis> analyses) {
        if (analyses == null || analyses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(analyses.get(0));
    }

    public ExpirationGroups getExpirationsByType(List<ExpirationAnalysis> analyses) {
        ExpirationGroups groups = new ExpirationGroups();
        if (analyses == null) {
            return groups;
        }
        for (ExpirationAnalysis a : analyses) {
            if (a.isMonthlyOpex()) {
                groups.getMonthly().add(a);
            } else if (a.isWeeklyOpex()) {
                groups.getWeekly().add(a);
            } else {
                groups.getOther().add(a);
            }
        }
        return groups;
    }

    /**
     * Merge walls from every expiration by strike. OI and strength are scaled by the
     * expiration weight; a strike with both call and put walls (or any COMBINED wall)
     * becomes COMBINED.
     */
    public GammaWallsResult aggregateGammaWalls(List<ExpirationAnalysis> analyses) {
        if (analyses == null || analyses.isEmpty()) {
            return GammaWallsResult.builder().walls(new ArrayList<>()).center(0).build();
        }

        Map<Double, WallAccumulator> byStrike = new LinkedHashMap<>();
        for (ExpirationAnalysis analysis : analyses) {
            for (GammaWall wall : analysis.getGammaWalls().getWalls()) {
                WallAccumulator acc = byStrike.computeIfAbsent(wall.getStrike(), k -> new WallAccumulator());
                acc.totalOI += wall.getOpenInterest() * analysis.getWeight();
                acc.totalStrength += wall.getRelativeStrength() * analysis.getWeight();
                acc.totalWeight += analysis.getWeight();
                acc.isSupport |= wall.isSupport();
                acc.isResistance |= wall.isResistance();
                acc.types.add(wall.getType());
            }
        }

        List<GammaWall> walls = new ArrayList<>();
        for (Map.Entry<Double, WallAccumulator> e : byStrike.entrySet()) {
            WallAccumulator acc = e.getValue();
            walls.add(GammaWall.builder()
                    .strike(e.getKey())
                    .type(acc.resolveType())
                    .openInterest(Math.round(acc.totalOI))
                    .relativeStrength(MathUtils.safeDivide(acc.totalStrength, acc.totalWeight, 0.0))
                    .isSupport(acc.isSupport)
                    .isResistance(acc.isResistance)
                    .build());
        }

        walls.sort(Comparator.comparingDouble(GammaWall::getRelativeStrength).reversed());

        double[] strikes = walls.stream().mapToDouble(GammaWall::getStrike).toArray();
        double[] weights = walls.stream().mapToDouble(w -> w.getOpenInterest() * w.getRelativeStrength()).toArray();

        return GammaWallsResult.builder()
                .walls(walls)
                .strongestSupport(walls.stream().filter(GammaWall::isSupport).findFirst().orElse(null))
                .strongestResistance(walls.stream().filter(GammaWall::isResistance).findFirst().orElse(null))
                .center(MathUtils.weightedAverage(strikes, weights, 0.0))
                .build();
    }

    private static class WallAccumulator {
        double totalOI;
        double totalStrength;
        double totalWeight;
        boolean isSupport;
        boolean isResistance;
        final Set<GammaWallType> types = EnumSet.noneOf(GammaWallType.class);

        GammaWallType resolveType() {
            if (types.contains(GammaWallType.COMBINED)
                    || (types.contains(GammaWallType.CALL_WALL) && types.contains(GammaWallType.PUT_WALL))) {
                return GammaWallType.COMBINED;
            }
            return types.contains(GammaWallType.CALL_WALL) ? GammaWallType.CALL_WALL : GammaWallType.PUT_WALL;
        }
    }
}
