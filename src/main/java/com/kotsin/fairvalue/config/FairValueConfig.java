package com.kotsin.fairvalue.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the psychological fair value engine.
 *
 * Every default below is the production-calibrated value. The confidence blends and
 * thresholds are load-bearing for downstream consumers, so retune them only with data.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pfv")
public class FairValueConfig {

    // ========== MAX PAIN ==========
    private MaxPain maxPain = new MaxPain();

    @Data
    public static class MaxPain {
        // Strike band as a fraction of spot; excludes stale LEAPS and pre-split strikes
        private double bandLow = 0.6;
        private double bandHigh = 1.4;
        private int contractMultiplier = 100;

        // Confidence terms: OI magnitude + concentration near the pin + strike density
        private double oiCap = 250_000;
        private double oiFactorCap = 0.4;
        private double concentrationRange = 0.05;
        private double concentrationFactorCap = 0.3;
        private double concentrationScale = 0.5;
        private double densityCap = 0.3;
        private int densityStrikes = 50;
    }

    // ========== GAMMA WALLS ==========
    private Gamma gamma = new Gamma();

    @Data
    public static class Gamma {
        private double bandLow = 0.7;
        private double bandHigh = 1.3;
        private double thresholdMultiplier = 2.0;
    }

    // ========== TECHNICAL LEVELS ==========
    private Technical technical = new Technical();

    @Data
    public static class Technical {
        private double distanceDecayPercent = 10.0;
        private double clusterThresholdPercent = 2.0;
        private double nearLevelTolerancePercent = 1.0;
    }

    // ========== ROUND NUMBERS ==========
    private RoundNumber roundNumber = new RoundNumber();

    @Data
    public static class RoundNumber {
        private double bandFraction = 0.20;
        private double distanceDecay = 5.0;
    }

    // ========== MULTI-EXPIRATION ==========
    private Expiration expiration = new Expiration();

    @Data
    public static class Expiration {
        private int minDte = 0;
        private int maxDte = 60;
        private double timeDecayDays = 30.0;
        private double monthlyOpexMultiplier = 1.5;
        private double weeklyOpexMultiplier = 1.2;
        private int providerMaxExpirations = 4;
        private boolean parallel = false;
        private int poolSize = 4;
    }

    // ========== COMPOSER ==========
    private Composer composer = new Composer();

    @Data
    public static class Composer {
        private double biasThresholdPercent = 2.0;

        // Confidence blend (Total: 1.0)
        private double convergenceWeight = 0.4;
        private double optionsQualityWeight = 0.4;
        private double distanceWeight = 0.2;

        private double convergenceScale = 10.0;
        private double distanceScale = 3.0;
        private double distanceFloor = 0.3;
        private double noOptionsQuality = 0.3;

        private double highThreshold = 0.7;
        private double mediumThreshold = 0.4;

        private int maxMagneticLevels = 15;
        private double minLevelStrength = 0.3;
        private int wallsPerExpiration = 3;
        private int roundLevels = 5;
    }

    // ========== DATA FRESHNESS ==========
    private Freshness freshness = new Freshness();

    @Data
    public static class Freshness {
        private String zone = "America/New_York";
        private String marketOpen = "09:30";
        private String marketClose = "16:00";
    }

    // ========== RESULT CACHE ==========
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private long ttlMinutes = 5;
        private long maxSize = 500;
    }

    // ========== TICKER CLASSIFICATION ==========
    private Classification classification = new Classification();

    @Data
    public static class Classification {
        private List<String> etf = new ArrayList<>();
        private List<String> memeRetail = new ArrayList<>();
        private List<String> blueChip = new ArrayList<>();
    }
}
