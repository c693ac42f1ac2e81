package com.kotsin.fairvalue.technical.analyzer;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.BiasSentiment;
import com.kotsin.fairvalue.technical.model.ConfluenceZone;
import com.kotsin.fairvalue.technical.model.LevelStrength;
import com.kotsin.fairvalue.technical.model.Milestone;
import com.kotsin.fairvalue.technical.model.PriceZone;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import com.kotsin.fairvalue.technical.model.TechnicalLevel;
import com.kotsin.fairvalue.technical.model.TechnicalLevelType;
import com.kotsin.fairvalue.technical.model.TechnicalLevelsResult;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * TechnicalLevelAnalyzer - Support/resistance levels from moving averages, the 52-week
 * range, recent swings, VWAP and the previous close.
 *
 * Strengths:
 * - STRONG: MA200, 52W high, 52W low
 * - MODERATE: MA50, swing high/low, VWAP
 * - WEAK: MA20, previous close
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TechnicalLevelAnalyzer {

    private static final String LOG_PREFIX = "[TECH-LEVELS]";

    private final FairValueConfig config;

    /**
     * Build one level per populated field. Absent, non-positive or non-finite fields are skipped.
     * Caller guarantees currentPrice is valid.
     */
    public TechnicalLevelsResult analyzeTechnicalLevels(TechnicalData data) {
        double currentPrice = data.getCurrentPrice();
        List<TechnicalLevel> levels = new ArrayList<>();

        addLevel(levels, data.getMa20(), TechnicalLevelType.MA20, LevelStrength.WEAK, currentPrice);
        addLevel(levels, data.getMa50(), TechnicalLevelType.MA50, LevelStrength.MODERATE, currentPrice);
        addLevel(levels, data.getMa200(), TechnicalLevelType.MA200, LevelStrength.STRONG, currentPrice);
        addLevel(levels, data.getFiftyTwoWeekHigh(), TechnicalLevelType.FIFTY_TWO_WEEK_HIGH, LevelStrength.STRONG, currentPrice);
        addLevel(levels, data.getFiftyTwoWeekLow(), TechnicalLevelType.FIFTY_TWO_WEEK_LOW, LevelStrength.STRONG, currentPrice);
        addLevel(levels, data.getRecentSwingHigh(), TechnicalLevelType.SWING_HIGH, LevelStrength.MODERATE, currentPrice);
        addLevel(levels, data.getRecentSwingLow(), TechnicalLevelType.SWING_LOW, LevelStrength.MODERATE, currentPrice);
        addLevel(levels, data.getVwap(), TechnicalLevelType.VWAP, LevelStrength.MODERATE, currentPrice);
        addLevel(levels, data.getPreviousClose(), TechnicalLevelType.PREV_CLOSE, LevelStrength.WEAK, currentPrice);

        levels.sort(Comparator.comparingDouble(l -> Math.abs(l.getDistance())));

        TechnicalLevel nearestSupport = levels.stream().filter(TechnicalLevel::isSupport).findFirst().orElse(null);
        TechnicalLevel nearestResistance = levels.stream().filter(TechnicalLevel::isResistance).findFirst().orElse(null);
        double weightedCenter = calculateWeightedCenter(levels, currentPrice);

        log.debug("{} levels={}, center={}, support={}, resistance={}", LOG_PREFIX, levels.size(),
                String.format("%.2f", weightedCenter),
                nearestSupport != null ? nearestSupport.getType().getLabel() : "none",
                nearestResistance != null ? nearestResistance.getType().getLabel() : "none");

        return TechnicalLevelsResult.builder()
                .levels(levels)
                .nearestSupport(nearestSupport)
                .nearestResistance(nearestResistance)
                .weightedCenter(weightedCenter)
                .build();
    }

    /**
     * Weight = strengthWeight / (1 + |distance%| / 10): strong levels close to price dominate.
     */
    private double calculateWeightedCenter(List<TechnicalLevel> levels, double currentPrice) {
        double decay = config.getTechnical().getDistanceDecayPercent();
        double[] prices = new double[levels.size()];
        double[] weights = new double[levels.size()];
        for (int i = 0; i < levels.size(); i++) {
            TechnicalLevel level = levels.get(i);
            prices[i] = level.getPrice();
            weights[i] = level.getStrength().getWeight() * (1.0 / (1.0 + Math.abs(level.getDistance()) / decay));
        }
        return MathUtils.weightedAverage(prices, weights, currentPrice);
    }

    // ======================== LEVEL QUERIES ========================

    public Optional<TechnicalLevel> isNearKeyLevel(List<TechnicalLevel> levels) {
        return isNearKeyLevel(levels, config.getTechnical().getNearLevelTolerancePercent());
    }

    /**
     * First level (in list order) whose |distance| is within tolerancePercent.
     */
    public Optional<TechnicalLevel> isNearKeyLevel(List<TechnicalLevel> levels, double tolerancePercent) {
        if (levels == null) {
            return Optional.empty();
        }
        return levels.stream()
                .filter(l -> Math.abs(l.getDistance()) <= tolerancePercent)
                .findFirst();
    }

    public List<ConfluenceZone> findConfluenceZones(List<TechnicalLevel> levels, double currentPrice) {
        return findConfluenceZones(levels, currentPrice, config.getTechnical().getClusterThresholdPercent());
    }

    /**
     * Cluster levels sorted by price: a level joins the current cluster when its gap to the
     * previous member is within clusterThresholdPercent. Clusters of two or more become zones,
     * support if the midpoint is below current price. Sorted by strength descending.
     */
    public List<ConfluenceZone> findConfluenceZones(List<TechnicalLevel> levels, double currentPrice,
                                                    double clusterThresholdPercent) {
        List<ConfluenceZone> zones = new ArrayList<>();
        if (levels == null || levels.size() < 2) {
            return zones;
        }

        List<TechnicalLevel> sorted = new ArrayList<>(levels);
        sorted.sort(Comparator.comparingDouble(TechnicalLevel::getPrice));

        List<TechnicalLevel> cluster = new ArrayList<>();
        cluster.add(sorted.get(0));

        for (int i = 1; i < sorted.size(); i++) {
            TechnicalLevel level = sorted.get(i);
            TechnicalLevel last = cluster.get(cluster.size() - 1);
            double gapPercent = MathUtils.safeDivide(level.getPrice() - last.getPrice(), last.getPrice(), Double.MAX_VALUE) * 100;

            if (gapPercent <= clusterThresholdPercent) {
                cluster.add(level);
            } else {
                closeCluster(cluster, currentPrice, zones);
                cluster = new ArrayList<>();
                cluster.add(level);
            }
        }
        closeCluster(cluster, currentPrice, zones);

        zones.sort(Comparator.comparingDouble(ConfluenceZone::getStrength).reversed());
        return zones;
    }

    private void closeCluster(List<TechnicalLevel> cluster, double currentPrice, List<ConfluenceZone> zones) {
        if (cluster.size() < 2) {
            return;
        }
        PriceZone zone = PriceZone.builder()
                .low(cluster.get(0).getPrice())
                .high(cluster.get(cluster.size() - 1).getPrice())
                .build();
        double strength = cluster.stream().mapToInt(l -> l.getStrength().getWeight()).average().orElse(0);

        zones.add(ConfluenceZone.builder()
                .zone(zone)
                .levels(new ArrayList<>(cluster))
                .isSupport(zone.getMidpoint() < currentPrice)
                .strength(strength)
                .build());
    }

    /**
     * Vote of price against moving averages: above MA200 counts double, above MA50 and
     * above MA20 once each, and MA20 &gt; MA50 &gt; MA200 once. Ratio &gt;= 0.7 is BULLISH,
     * &lt;= 0.3 BEARISH; NEUTRAL when no MA is available.
     */
    public BiasSentiment determineTrendBias(TechnicalData data) {
        double price = data.getCurrentPrice();
        Double ma20 = valid(data.getMa20());
        Double ma50 = valid(data.getMa50());
        Double ma200 = valid(data.getMa200());

        int bullish = 0;
        int total = 0;

        if (ma200 != null) {
            total += 2;
            if (price > ma200) bullish += 2;
        }
        if (ma50 != null) {
            total += 1;
            if (price > ma50) bullish += 1;
        }
        if (ma20 != null) {
            total += 1;
            if (price > ma20) bullish += 1;
        }
        if (ma20 != null && ma50 != null && ma200 != null) {
            total += 1;
            if (ma20 > ma50 && ma50 > ma200) bullish += 1;
        }

        if (total == 0) {
            return BiasSentiment.NEUTRAL;
        }

        double ratio = (double) bullish / total;
        if (ratio >= 0.7) return BiasSentiment.BULLISH;
        if (ratio <= 0.3) return BiasSentiment.BEARISH;
        return BiasSentiment.NEUTRAL;
    }

    /**
     * 52-week high, 52-week low and MA200 as milestones, closest first.
     * The high always reads UP and the low DOWN; MA200 follows its side of price.
     */
    public List<Milestone> calculateMilestones(TechnicalData data) {
        double price = data.getCurrentPrice();
        List<Milestone> milestones = new ArrayList<>();
        addMilestone(milestones, "52-Week High", valid(data.getFiftyTwoWeekHigh()), price, Milestone.Direction.UP);
        addMilestone(milestones, "52-Week Low", valid(data.getFiftyTwoWeekLow()), price, Milestone.Direction.DOWN);

        Double ma200 = valid(data.getMa200());
        if (ma200 != null) {
            addMilestone(milestones, "200 MA", ma200, price,
                    ma200 > price ? Milestone.Direction.UP : Milestone.Direction.DOWN);
        }

        milestones.sort(Comparator.comparingDouble(m -> Math.abs(m.getDistance())));
        return milestones;
    }

    private static void addMilestone(List<Milestone> milestones, String name, Double level, double price,
                                     Milestone.Direction direction) {
        if (level == null) {
            return;
        }
        milestones.add(Milestone.builder()
                .name(name)
                .price(level)
                .distance((level - price) / price * 100)
                .direction(direction)
                .build());
    }

    private static void addLevel(List<TechnicalLevel> levels, Double price, TechnicalLevelType type,
                                 LevelStrength strength, double currentPrice) {
        if (!MathUtils.isValidPositive(price)) {
            return;
        }
        double distance = (price - currentPrice) / currentPrice * 100;
        levels.add(TechnicalLevel.builder()
                .price(price)
                .type(type)
                .strength(strength)
                .distance(distance)
                .isSupport(price < currentPrice)
                .isResistance(price > currentPrice)
                .build());
    }

    private static Double valid(Double value) {
        return MathUtils.isValidPositive(value) ? value : null;
    }
}
