package com.kotsin.fairvalue.fairvalue.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevel;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevelType;
import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.options.model.GammaWall;
import com.kotsin.fairvalue.technical.model.RoundNumberLevel;
import com.kotsin.fairvalue.technical.model.RoundNumberSignificance;
import com.kotsin.fairvalue.technical.model.TechnicalLevel;
import com.kotsin.fairvalue.technical.model.TechnicalLevelType;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MagneticLevelCollector - Merges every price level source into one ranked list.
 *
 * Sources and strengths:
 * - Max pain per expiration: max pain confidence
 * - Top walls per expiration: min(1, relativeStrength / 5)
 * - Technical levels: STRONG 0.9, MODERATE 0.6, WEAK 0.3
 * - Top round numbers by pull: the pull itself
 *
 * Levels that round to the same price collapse into the strongest one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MagneticLevelCollector {

    private static final double WALL_STRENGTH_SCALE = 5.0;

    private final FairValueConfig config;

    public List<MagneticLevel> collect(List<ExpirationAnalysis> analyses,
                                       List<TechnicalLevel> technicalLevels,
                                       List<RoundNumberLevel> roundLevels,
                                       double currentPrice,
                                       boolean includeAll,
                                       int maxLevels) {
        FairValueConfig.Composer cfg = config.getComposer();
        List<MagneticLevel> candidates = new ArrayList<>();

        for (ExpirationAnalysis exp : analyses) {
            candidates.add(MagneticLevel.builder()
                    .price(exp.getMaxPain().getPrice())
                    .type(MagneticLevelType.MAX_PAIN)
                    .strength(exp.getMaxPain().getConfidence())
                    .distance(distancePercent(exp.getMaxPain().getPrice(), currentPrice))
                    .expiration(exp.getExpiration())
                    .build());

            List<GammaWall> walls = exp.getGammaWalls().getWalls();
            for (GammaWall wall : walls.subList(0, Math.min(cfg.getWallsPerExpiration(), walls.size()))) {
                candidates.add(MagneticLevel.builder()
                        .price(wall.getStrike())
                        .type(mapWallType(wall))
                        .strength(Math.min(1.0, wall.getRelativeStrength() / WALL_STRENGTH_SCALE))
                        .distance(distancePercent(wall.getStrike(), currentPrice))
                        .expiration(exp.getExpiration())
                        .build());
            }
        }

        for (TechnicalLevel level : technicalLevels) {
            candidates.add(MagneticLevel.builder()
                    .price(level.getPrice())
                    .type(mapTechnicalType(level.getType()))
                    .strength(level.getStrength().getMagneticStrength())
                    .distance(level.getDistance())
                    .build());
        }

        for (RoundNumberLevel level : roundLevels.subList(0, Math.min(cfg.getRoundLevels(), roundLevels.size()))) {
            candidates.add(MagneticLevel.builder()
                    .price(level.getPrice())
                    .type(level.getSignificance() == RoundNumberSignificance.MAJOR
                            ? MagneticLevelType.ROUND_MAJOR
                            : MagneticLevelType.ROUND_MODERATE)
                    .strength(level.getMagneticPull())
                    .distance(level.getDistance())
                    .build());
        }

        List<MagneticLevel> deduped = deduplicate(candidates);

        List<MagneticLevel> result = deduped.stream()
                .filter(l -> includeAll || l.getStrength() >= cfg.getMinLevelStrength())
                .sorted(Comparator.comparingDouble(MagneticLevel::getStrength).reversed())
                .limit(Math.max(0, maxLevels))
                .collect(Collectors.toList());

        log.debug("[MAGNETIC-LEVELS] candidates={}, unique={}, kept={}",
                candidates.size(), deduped.size(), result.size());
        return result;
    }

    /**
     * Collapse levels with the same rounded price. A later level replaces an earlier one
     * only when strictly stronger; the survivor carries the rounded price.
     */
    List<MagneticLevel> deduplicate(List<MagneticLevel> levels) {
        Map<Double, MagneticLevel> byPrice = new LinkedHashMap<>();
        for (MagneticLevel level : levels) {
            double rounded = MathUtils.roundPrice(level.getPrice());
            MagneticLevel existing = byPrice.get(rounded);
            if (existing == null || level.getStrength() > existing.getStrength()) {
                byPrice.put(rounded, MagneticLevel.builder()
                        .price(rounded)
                        .type(level.getType())
                        .strength(level.getStrength())
                        .distance(level.getDistance())
                        .expiration(level.getExpiration())
                        .build());
            }
        }
        return new ArrayList<>(byPrice.values());
    }

    private static MagneticLevelType mapWallType(GammaWall wall) {
        return switch (wall.getType()) {
            case CALL_WALL -> MagneticLevelType.CALL_WALL;
            case PUT_WALL -> MagneticLevelType.PUT_WALL;
            case COMBINED -> MagneticLevelType.GAMMA_WALL;
        };
    }

    private static MagneticLevelType mapTechnicalType(TechnicalLevelType type) {
        return switch (type) {
            case MA20 -> MagneticLevelType.MA20;
            case MA50 -> MagneticLevelType.MA50;
            case MA200 -> MagneticLevelType.MA200;
            case FIFTY_TWO_WEEK_HIGH -> MagneticLevelType.FIFTY_TWO_WEEK_HIGH;
            case FIFTY_TWO_WEEK_LOW -> MagneticLevelType.FIFTY_TWO_WEEK_LOW;
            case SWING_HIGH -> MagneticLevelType.SWING_HIGH;
            case SWING_LOW -> MagneticLevelType.SWING_LOW;
            case VWAP -> MagneticLevelType.VWAP;
            case PREV_CLOSE -> MagneticLevelType.PREV_CLOSE;
        };
    }

    private static double distancePercent(double price, double currentPrice) {
        return (price - currentPrice) / currentPrice * 100;
    }
}
