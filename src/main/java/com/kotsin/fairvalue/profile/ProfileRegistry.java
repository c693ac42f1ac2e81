package com.kotsin.fairvalue.profile;

import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.profile.model.ProfileType;
import com.kotsin.fairvalue.profile.model.ProfileWeights;
import com.kotsin.fairvalue.profile.model.TickerProfile;
import com.kotsin.fairvalue.profile.model.WeightOverrides;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ProfileRegistry - Resolves which behavioral profile (and therefore which component
 * weights) applies to a ticker.
 *
 * Resolution order:
 * 1. Classification provider (configured ETF / meme / blue-chip lists)
 * 2. Heuristic rules over price, 52w range and open interest (only with options data)
 * 3. DEFAULT
 */
@Slf4j
@Component
public class ProfileRegistry {

    private static final String LOG_PREFIX = "[PROFILE]";
    private static final double WEIGHT_SUM_TOLERANCE = 0.001;

    private static final Map<ProfileType, TickerProfile> PROFILES = new EnumMap<>(ProfileType.class);

    static {
        PROFILES.put(ProfileType.BLUE_CHIP, TickerProfile.builder()
                .type(ProfileType.BLUE_CHIP)
                .name("Blue Chip")
                .description("Large-cap institutional stocks (AAPL, MSFT, GOOGL)")
                .weights(new ProfileWeights(0.25, 0.10, 0.30, 0.25, 0.10))
                .characteristics(List.of(
                        "Institutional-driven price action",
                        "VWAP and MA levels highly respected",
                        "Options mechanics moderate influence",
                        "Round numbers less impactful due to algo trading"))
                .build());

        PROFILES.put(ProfileType.MEME_RETAIL, TickerProfile.builder()
                .type(ProfileType.MEME_RETAIL)
                .name("Meme / High Retail")
                .description("Retail-driven stocks (GME, AMC, PLTR, RIVN)")
                .weights(new ProfileWeights(0.20, 0.25, 0.15, 0.15, 0.25))
                .characteristics(List.of(
                        "Retail sentiment drives price",
                        "Round numbers are very significant",
                        "Gamma squeezes common",
                        "Technical levels often ignored in frenzies"))
                .build());

        PROFILES.put(ProfileType.ETF, TickerProfile.builder()
                .type(ProfileType.ETF)
                .name("ETF")
                .description("Index ETFs with massive options volume (SPY, QQQ, IWM)")
                .weights(new ProfileWeights(0.35, 0.10, 0.25, 0.20, 0.10))
                .characteristics(List.of(
                        "Massive options volume makes max pain reliable",
                        "Institutional OPEX pinning is well-documented",
                        "Round numbers at major levels ($500, $450)",
                        "Highly efficient market"))
                .build());

        PROFILES.put(ProfileType.LOW_FLOAT, TickerProfile.builder()
                .type(ProfileType.LOW_FLOAT)
                .name("Low Float / Squeeze Candidate")
                .description("Small float stocks prone to gamma squeezes")
                .weights(new ProfileWeights(0.20, 0.30, 0.20, 0.15, 0.15))
                .characteristics(List.of(
                        "Gamma effects are exaggerated",
                        "Can overshoot all levels during squeeze",
                        "Use fair value as gravitational center post-squeeze",
                        "High volatility expected"))
                .build());

        PROFILES.put(ProfileType.DEFAULT, TickerProfile.builder()
                .type(ProfileType.DEFAULT)
                .name("Standard")
                .description("Balanced approach for unknown ticker types")
                .weights(new ProfileWeights(0.30, 0.10, 0.25, 0.20, 0.15))
                .characteristics(List.of(
                        "Balanced weighting across all factors",
                        "Good starting point for analysis",
                        "May need adjustment based on behavior"))
                .build());
    }

    private final TickerClassificationProvider classificationProvider;
    private final List<ProfileHeuristic> heuristics;

    @Autowired
    public ProfileRegistry(TickerClassificationProvider classificationProvider) {
        this(classificationProvider, ProfileHeuristic.defaults());
    }

    public ProfileRegistry(TickerClassificationProvider classificationProvider, List<ProfileHeuristic> heuristics) {
        this.classificationProvider = classificationProvider;
        this.heuristics = List.copyOf(heuristics);
    }

    // ======================== RESOLUTION ========================

    public TickerProfile resolveProfile(String ticker) {
        return resolveProfile(ticker, null, null);
    }

    /**
     * Resolve the profile for a ticker. Heuristics only run when technical data and
     * at least one expiration are supplied.
     */
    public TickerProfile resolveProfile(String ticker, TechnicalData technicalData, List<OptionsExpiration> expirations) {
        Optional<ProfileType> classified = classificationProvider.classify(ticker);
        if (classified.isPresent()) {
            log.debug("{} {} classified as {}", LOG_PREFIX, ticker, classified.get());
            return getProfile(classified.get());
        }

        if (technicalData != null && expirations != null && !expirations.isEmpty()) {
            ProfileHeuristic.Context context = buildContext(technicalData, expirations);
            for (ProfileHeuristic heuristic : heuristics) {
                if (heuristic.matches(context)) {
                    log.debug("{} {} matched heuristic '{}' -> {} (rangeRatio={}, totalOI={})",
                            LOG_PREFIX, ticker, heuristic.getName(), heuristic.getProfile(),
                            String.format("%.2f", context.getRangeRatio()), context.getTotalOpenInterest());
                    return getProfile(heuristic.getProfile());
                }
            }
        }

        return getProfile(ProfileType.DEFAULT);
    }

    /**
     * Merge caller overrides onto the profile's weights and renormalize.
     * Returns a profile whose weights always sum to 1.0.
     */
    public TickerProfile applyOverrides(TickerProfile profile, WeightOverrides overrides) {
        ProfileWeights merged = mergeWeights(profile.getWeights(), overrides);
        return profile.toBuilder()
                .weights(normalizeWeights(merged))
                .characteristics(new ArrayList<>(profile.getCharacteristics()))
                .build();
    }

    // ======================== CATALOG ========================

    /**
     * Fresh copy of a built-in profile, so callers can never mutate the catalog.
     */
    public TickerProfile getProfile(ProfileType type) {
        TickerProfile base = PROFILES.get(type != null ? type : ProfileType.DEFAULT);
        return base.toBuilder()
                .weights(base.getWeights().toBuilder().build())
                .characteristics(new ArrayList<>(base.getCharacteristics()))
                .build();
    }

    public Map<ProfileType, TickerProfile> getAllProfiles() {
        Map<ProfileType, TickerProfile> copy = new EnumMap<>(ProfileType.class);
        for (ProfileType type : ProfileType.values()) {
            copy.put(type, getProfile(type));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Build a custom profile on top of a base profile. Weights are merged but not
     * normalized; use {@link #validateWeights(ProfileWeights)} to check the result.
     */
    public TickerProfile createCustomProfile(ProfileType baseType, WeightOverrides overrides, String name) {
        TickerProfile base = getProfile(baseType);
        return base.toBuilder()
                .name(name != null && !name.isBlank() ? name : "Custom (" + base.getName() + ")")
                .weights(mergeWeights(base.getWeights(), overrides))
                .build();
    }

    // ======================== WEIGHT MATH ========================

    public static ProfileWeights mergeWeights(ProfileWeights base, WeightOverrides overrides) {
        ProfileWeights merged = base.toBuilder().build();
        if (overrides == null) {
            return merged;
        }
        if (overrides.getMaxPain() != null) merged.setMaxPain(overrides.getMaxPain());
        if (overrides.getGammaWalls() != null) merged.setGammaWalls(overrides.getGammaWalls());
        if (overrides.getTechnical() != null) merged.setTechnical(overrides.getTechnical());
        if (overrides.getVolume() != null) merged.setVolume(overrides.getVolume());
        if (overrides.getRoundNumber() != null) merged.setRoundNumber(overrides.getRoundNumber());
        return merged;
    }

    /**
     * Rescale so the five components sum to 1.0. Negative or non-finite components
     * count as zero; an all-zero bundle becomes five equal 0.2 weights.
     */
    public static ProfileWeights normalizeWeights(ProfileWeights weights) {
        double maxPain = nonNegative(weights.getMaxPain());
        double gamma = nonNegative(weights.getGammaWalls());
        double technical = nonNegative(weights.getTechnical());
        double volume = nonNegative(weights.getVolume());
        double round = nonNegative(weights.getRoundNumber());

        double sum = maxPain + gamma + technical + volume + round;
        if (sum <= 0) {
            return ProfileWeights.equal();
        }

        return ProfileWeights.builder()
                .maxPain(maxPain / sum)
                .gammaWalls(gamma / sum)
                .technical(technical / sum)
                .volume(volume / sum)
                .roundNumber(round / sum)
                .build();
    }

    public static boolean validateWeights(ProfileWeights weights) {
        return weights != null && Math.abs(weights.getTotal() - 1.0) < WEIGHT_SUM_TOLERANCE;
    }

    private static double nonNegative(double value) {
        return MathUtils.isValidNumber(value) && value > 0 ? value : 0.0;
    }

    private static ProfileHeuristic.Context buildContext(TechnicalData data, List<OptionsExpiration> expirations) {
        double price = data.getCurrentPrice() != null ? data.getCurrentPrice() : 0.0;

        long totalOI = 0;
        for (OptionsExpiration exp : expirations) {
            if (exp != null) {
                totalOI += exp.getTotalOI();
            }
        }

        double rangeRatio = Double.NaN;
        if (MathUtils.isValidPositive(data.getFiftyTwoWeekHigh()) && MathUtils.isValidPositive(data.getFiftyTwoWeekLow())) {
            rangeRatio = MathUtils.safeDivide(data.getFiftyTwoWeekHigh() - data.getFiftyTwoWeekLow(), price, Double.NaN);
        }
        return new ProfileHeuristic.Context(price, rangeRatio, totalOI);
    }
}
