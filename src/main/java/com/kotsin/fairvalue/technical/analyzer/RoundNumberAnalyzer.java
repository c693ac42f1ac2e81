package com.kotsin.fairvalue.technical.analyzer;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.BiasSentiment;
import com.kotsin.fairvalue.technical.model.RoundNumberInterval;
import com.kotsin.fairvalue.technical.model.RoundNumberLevel;
import com.kotsin.fairvalue.technical.model.RoundNumberSignificance;
import com.kotsin.fairvalue.technical.model.RoundNumbersResult;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RoundNumberAnalyzer - Magnetism of psychologically round prices.
 *
 * Tiers by price magnitude (major / moderate / minor spacing):
 *   &gt;= 500: 100 / 50 / 25
 *   &gt;= 100: 50 / 25 / 10
 *   &gt;= 50:  25 / 10 / 5
 *   &gt;= 20:  10 / 5 / 2.5
 *   &gt;= 10:  5 / 2.5 / 1
 *   &lt; 10:   1 / 0.5 / 0.25
 *
 * Pull = (significance weight + roundness bonus) x exp(-5 x |distance fraction|), capped at 1.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RoundNumberAnalyzer {

    private static final String LOG_PREFIX = "[ROUND-NUMBERS]";

    // Narrow band used by the "at a round number" and bias checks
    private static final double NEAR_BAND_FRACTION = 0.05;
    private static final double DEFAULT_MAGNET_DISTANCE_PERCENT = 5.0;
    private static final double DEFAULT_AT_ROUND_TOLERANCE_PERCENT = 0.5;

    private final FairValueConfig config;

    public RoundNumbersResult analyzeRoundNumbers(double currentPrice) {
        return analyzeRoundNumbers(currentPrice, config.getRoundNumber().getBandFraction());
    }

    /**
     * Every multiple of each tier interval within [price x (1 - band), price x (1 + band)],
     * deduplicated by price (higher significance wins) and sorted by pull descending.
     */
    public RoundNumbersResult analyzeRoundNumbers(double currentPrice, double bandFraction) {
        double minPrice = currentPrice * (1 - bandFraction);
        double maxPrice = currentPrice * (1 + bandFraction);

        Map<Double, RoundNumberLevel> byPrice = new LinkedHashMap<>();

        for (RoundNumberInterval tier : intervalsFor(currentPrice)) {
            double interval = tier.getInterval();
            long k = (long) Math.floor(minPrice / interval);

            // Multiples are generated as k x interval so large k does not accumulate drift
            for (double price = k * interval; price <= maxPrice; price = (++k) * interval) {
                if (price <= 0 || price < minPrice) {
                    continue;
                }
                RoundNumberLevel level = RoundNumberLevel.builder()
                        .price(price)
                        .significance(tier.getSignificance())
                        .distance((price - currentPrice) / currentPrice * 100)
                        .magneticPull(calculateMagneticPull(price, currentPrice, tier.getSignificance()))
                        .build();

                RoundNumberLevel existing = byPrice.get(price);
                if (existing == null || tier.getSignificance().getRank() > existing.getSignificance().getRank()) {
                    byPrice.put(price, level);
                }
            }
        }

        List<RoundNumberLevel> levels = new ArrayList<>(byPrice.values());
        levels.sort(Comparator.comparingDouble(RoundNumberLevel::getMagneticPull).reversed());

        RoundNumberLevel nearestMajor = levels.stream()
                .filter(l -> l.getSignificance() == RoundNumberSignificance.MAJOR)
                .min(Comparator.comparingDouble(l -> Math.abs(l.getDistance())))
                .orElse(null);

        double[] prices = levels.stream().mapToDouble(RoundNumberLevel::getPrice).toArray();
        double[] pulls = levels.stream().mapToDouble(RoundNumberLevel::getMagneticPull).toArray();
        double magneticCenter = MathUtils.weightedAverage(prices, pulls, currentPrice);

        log.debug("{} price={}, band=[{}, {}], levels={}, center={}", LOG_PREFIX, currentPrice,
                String.format("%.2f", minPrice), String.format("%.2f", maxPrice), levels.size(),
                String.format("%.2f", magneticCenter));

        return RoundNumbersResult.builder()
                .levels(levels)
                .nearestMajor(nearestMajor)
                .magneticCenter(magneticCenter)
                .build();
    }

    /**
     * Interval tier for a price, major first.
     */
    public static List<RoundNumberInterval> intervalsFor(double price) {
        if (price >= 500) return tier(100, 50, 25);
        if (price >= 100) return tier(50, 25, 10);
        if (price >= 50) return tier(25, 10, 5);
        if (price >= 20) return tier(10, 5, 2.5);
        if (price >= 10) return tier(5, 2.5, 1);
        return tier(1, 0.5, 0.25);
    }

    private double calculateMagneticPull(double levelPrice, double currentPrice, RoundNumberSignificance significance) {
        double distanceFraction = Math.abs((levelPrice - currentPrice) / currentPrice);
        double distanceFactor = Math.exp(-distanceFraction * config.getRoundNumber().getDistanceDecay());

        double roundnessBonus = 0;
        if (levelPrice % 100 == 0) roundnessBonus = 0.2;
        else if (levelPrice % 50 == 0) roundnessBonus = 0.1;
        else if (levelPrice % 25 == 0) roundnessBonus = 0.05;

        return Math.min(1.0, (significance.getBaseWeight() + roundnessBonus) * distanceFactor);
    }

    // ======================== MAGNET QUERIES ========================

    public Optional<RoundNumberLevel> findStrongestMagnet(double currentPrice) {
        return findStrongestMagnet(currentPrice, DEFAULT_MAGNET_DISTANCE_PERCENT);
    }

    /**
     * Round number with the highest pull within maxDistancePercent of the price.
     */
    public Optional<RoundNumberLevel> findStrongestMagnet(double currentPrice, double maxDistancePercent) {
        return analyzeRoundNumbers(currentPrice, maxDistancePercent / 100).getLevels().stream()
                .filter(l -> Math.abs(l.getDistance()) <= maxDistancePercent)
                .max(Comparator.comparingDouble(RoundNumberLevel::getMagneticPull));
    }

    public Optional<RoundNumberLevel> isAtRoundNumber(double currentPrice) {
        return isAtRoundNumber(currentPrice, DEFAULT_AT_ROUND_TOLERANCE_PERCENT);
    }

    public Optional<RoundNumberLevel> isAtRoundNumber(double currentPrice, double tolerancePercent) {
        return analyzeRoundNumbers(currentPrice, NEAR_BAND_FRACTION).getLevels().stream()
                .filter(l -> Math.abs(l.getDistance()) <= tolerancePercent)
                .findFirst();
    }

    /**
     * Halfway points between major round numbers around the price; these often act as pivots.
     */
    public List<Double> getMidpointLevels(double currentPrice) {
        double majorInterval = intervalsFor(currentPrice).get(0).getInterval();
        double baseMajor = Math.floor(currentPrice / majorInterval) * majorInterval;

        List<Double> midpoints = new ArrayList<>();
        for (int i = -2; i <= 2; i++) {
            double midpoint = baseMajor + i * majorInterval + majorInterval / 2;
            if (midpoint > 0) {
                midpoints.add(midpoint);
            }
        }
        return midpoints;
    }

    /**
     * Just above a major round number reads as support (BULLISH), just below as
     * resistance (BEARISH). "Just" means less than half the distance to the other side.
     */
    public BiasSentiment getRoundNumberBias(double currentPrice) {
        List<RoundNumberLevel> majors = analyzeRoundNumbers(currentPrice, NEAR_BAND_FRACTION).getLevels().stream()
                .filter(l -> l.getSignificance() == RoundNumberSignificance.MAJOR)
                .toList();

        Optional<RoundNumberLevel> below = majors.stream()
                .filter(l -> l.getPrice() < currentPrice)
                .max(Comparator.comparingDouble(RoundNumberLevel::getPrice));
        Optional<RoundNumberLevel> above = majors.stream()
                .filter(l -> l.getPrice() > currentPrice)
                .min(Comparator.comparingDouble(RoundNumberLevel::getPrice));

        if (below.isEmpty() && above.isEmpty()) {
            return BiasSentiment.NEUTRAL;
        }

        double distBelow = below.map(l -> Math.abs((currentPrice - l.getPrice()) / currentPrice))
                .orElse(Double.POSITIVE_INFINITY);
        double distAbove = above.map(l -> Math.abs((l.getPrice() - currentPrice) / currentPrice))
                .orElse(Double.POSITIVE_INFINITY);

        if (distBelow < distAbove * 0.5) return BiasSentiment.BULLISH;
        if (distAbove < distBelow * 0.5) return BiasSentiment.BEARISH;
        return BiasSentiment.NEUTRAL;
    }

    private static List<RoundNumberInterval> tier(double major, double moderate, double minor) {
        return List.of(
                new RoundNumberInterval(major, RoundNumberSignificance.MAJOR),
                new RoundNumberInterval(moderate, RoundNumberSignificance.MODERATE),
                new RoundNumberInterval(minor, RoundNumberSignificance.MINOR));
    }
}
