package com.kotsin.fairvalue.fairvalue.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.data.MarketDataProvider;
import com.kotsin.fairvalue.fairvalue.calculator.FairValueComposer;
import com.kotsin.fairvalue.fairvalue.model.ConfidenceLevel;
import com.kotsin.fairvalue.fairvalue.model.FairValueInput;
import com.kotsin.fairvalue.fairvalue.model.FairValueOptions;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevel;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevelType;
import com.kotsin.fairvalue.fairvalue.model.MeanReversionSignal;
import com.kotsin.fairvalue.fairvalue.model.PsychologicalFairValue;
import com.kotsin.fairvalue.fairvalue.model.TradeDirection;
import com.kotsin.fairvalue.fairvalue.model.WallLevels;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.profile.model.ProfileType;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FairValueService - Entry point for callers of the engine.
 *
 * Two paths:
 * - calculate(): caller-supplied snapshot, never cached
 * - getFairValue(): snapshot pulled from the MarketDataProvider, cached per
 *   ticker/profile/options for pfv.cache.ttl-minutes
 */
@Service
@Slf4j
public class FairValueService {

    private static final String LOG_PREFIX = "[PFV-SERVICE]";
    private static final int DEFAULT_KEY_LEVELS = 5;
    private static final double SIGNAL_STRENGTH_PER_PERCENT = 10.0;
    private static final double MAX_SIGNAL_STRENGTH = 100.0;

    private final FairValueComposer composer;
    private final Optional<MarketDataProvider> marketDataProvider;
    private final FairValueConfig config;

    private final Cache<CacheKey, PsychologicalFairValue> cache;

    public FairValueService(FairValueComposer composer,
                            Optional<MarketDataProvider> marketDataProvider,
                            FairValueConfig config) {
        this.composer = composer;
        this.marketDataProvider = marketDataProvider;
        this.config = config;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(config.getCache().getTtlMinutes()))
                .maximumSize(config.getCache().getMaxSize())
                .recordStats()
                .build();

        if (marketDataProvider.isEmpty()) {
            log.info("{} No MarketDataProvider registered, ticker lookups are disabled", LOG_PREFIX);
        }
    }

    public PsychologicalFairValue calculate(FairValueInput input, FairValueOptions options) {
        return composer.calculatePsychologicalFairValue(input, options);
    }

    public Optional<PsychologicalFairValue> getFairValue(String ticker) {
        return getFairValue(ticker, null, FairValueOptions.defaults());
    }

    /**
     * Provider-backed fair value. Empty when no provider is registered, the provider has
     * no technical data for the ticker, the provider fails, or its snapshot is rejected.
     * Empty results are not cached.
     *
     * @param profileOverride optional profile that bypasses classification
     */
    public Optional<PsychologicalFairValue> getFairValue(String ticker, ProfileType profileOverride,
                                                         FairValueOptions options) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        FairValueOptions opts = options != null ? options.copy() : FairValueOptions.defaults();
        String normalized = ticker.trim().toUpperCase(Locale.ROOT);
        CacheKey key = new CacheKey(normalized, profileOverride, opts);

        // Concurrent misses for one key share a single load
        return Optional.ofNullable(cache.get(key, this::load));
    }

    private PsychologicalFairValue load(CacheKey key) {
        if (marketDataProvider.isEmpty()) {
            return null;
        }
        MarketDataProvider provider = marketDataProvider.get();
        String ticker = key.getTicker();

        TechnicalData technicalData;
        List<OptionsExpiration> expirations;
        try {
            Optional<TechnicalData> fetched = provider.fetchTechnicalData(ticker);
            if (fetched.isEmpty()) {
                log.warn("{} No technical data for {}", LOG_PREFIX, ticker);
                return null;
            }
            technicalData = fetched.get();
            List<OptionsExpiration> fetchedExpirations =
                    provider.fetchExpirations(ticker, config.getExpiration().getProviderMaxExpirations());
            expirations = fetchedExpirations != null ? fetchedExpirations : new ArrayList<>();
        } catch (RuntimeException e) {
            log.error("{} Market data fetch failed for {}: {}", LOG_PREFIX, ticker, e.getMessage(), e);
            return null;
        }

        FairValueInput input = FairValueInput.builder()
                .ticker(ticker)
                .technicalData(technicalData)
                .expirations(expirations)
                .profileOverride(key.getProfile())
                .build();

        try {
            return composer.calculatePsychologicalFairValue(input, key.getOptions());
        } catch (IllegalArgumentException e) {
            log.warn("{} Provider data for {} rejected: {}", LOG_PREFIX, ticker, e.getMessage());
            return null;
        }
    }

    public List<MagneticLevel> getKeyMagneticLevels(PsychologicalFairValue pfv) {
        return getKeyMagneticLevels(pfv, DEFAULT_KEY_LEVELS);
    }

    /**
     * Strongest levels first.
     */
    public List<MagneticLevel> getKeyMagneticLevels(PsychologicalFairValue pfv, int maxLevels) {
        return pfv.getMagneticLevels().stream()
                .sorted(Comparator.comparingDouble(MagneticLevel::getStrength).reversed())
                .limit(Math.max(0, maxLevels))
                .collect(Collectors.toList());
    }

    /**
     * Wall prices for spread construction. Combined walls count as call walls.
     */
    public WallLevels extractWalls(PsychologicalFairValue pfv) {
        List<Double> putWalls = new ArrayList<>();
        List<Double> callWalls = new ArrayList<>();
        for (MagneticLevel level : pfv.getMagneticLevels()) {
            if (level.getType() == MagneticLevelType.PUT_WALL) {
                putWalls.add(level.getPrice());
            } else if (level.getType() == MagneticLevelType.CALL_WALL
                    || level.getType() == MagneticLevelType.GAMMA_WALL) {
                callWalls.add(level.getPrice());
            }
        }
        return WallLevels.builder()
                .putWalls(putWalls)
                .callWalls(callWalls)
                .build();
    }

    /**
     * Reversion hint: LONG when fair value sits more than the bias threshold above price,
     * SHORT when it sits that far below. Never signals on LOW confidence.
     */
    public MeanReversionSignal meanReversionSignal(PsychologicalFairValue pfv) {
        double deviation = pfv.getDeviationPercent();
        double threshold = config.getComposer().getBiasThresholdPercent();
        if (Math.abs(deviation) <= threshold || pfv.getConfidence() == ConfidenceLevel.LOW) {
            return MeanReversionSignal.none();
        }
        return MeanReversionSignal.builder()
                .signal(true)
                .direction(deviation > 0 ? TradeDirection.LONG : TradeDirection.SHORT)
                .strength(Math.min(MAX_SIGNAL_STRENGTH, Math.abs(deviation) * SIGNAL_STRENGTH_PER_PERCENT))
                .build();
    }

    // ======================== CACHE ========================

    public void evict(String ticker) {
        if (ticker == null) {
            return;
        }
        String normalized = ticker.trim().toUpperCase(Locale.ROOT);
        cache.asMap().keySet().removeIf(k -> k.getTicker().equals(normalized));
        log.info("{} Evicted cached results for {}", LOG_PREFIX, normalized);
    }

    public void evictAll() {
        cache.invalidateAll();
        log.info("{} Cache cleared", LOG_PREFIX);
    }

    public Map<String, Object> cacheStats() {
        CacheStats stats = cache.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("size", cache.estimatedSize());
        result.put("hitCount", stats.hitCount());
        result.put("missCount", stats.missCount());
        result.put("hitRate", stats.hitRate());
        result.put("evictionCount", stats.evictionCount());
        result.put("ttlMinutes", config.getCache().getTtlMinutes());
        result.put("providerConfigured", marketDataProvider.isPresent());
        return result;
    }

    @Value
    static class CacheKey {
        String ticker;
        ProfileType profile;
        FairValueOptions options;
    }
}
