package com.kotsin.fairvalue.options.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.options.model.GammaExposure;
import com.kotsin.fairvalue.options.model.GammaWall;
import com.kotsin.fairvalue.options.model.GammaWallType;
import com.kotsin.fairvalue.options.model.GammaWallsResult;
import com.kotsin.fairvalue.options.model.OptionContract;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * GammaWallDetector - Finds strikes where market maker hedging creates support/resistance.
 *
 * A wall is a strike whose OI is at least thresholdMultiplier x the median OI of its side:
 * - CALL_WALL: call OI spike above spot (resistance)
 * - PUT_WALL: put OI spike below spot (support)
 * - COMBINED: both sides spike at the same strike; recorded in addition to the
 *   single-sided entries, so that strike's OI is counted twice in the center
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GammaWallDetector {

    private static final String LOG_PREFIX = "[GAMMA-WALLS]";

    // Approximate ATM gamma when the feed has no greeks
    private static final double PEAK_GAMMA = 0.05;
    private static final double MONEYNESS_DECAY = 10.0;

    private final FairValueConfig config;

    public GammaWallsResult detectGammaWalls(OptionsExpiration expiration, double currentPrice) {
        return detectGammaWalls(expiration, currentPrice, config.getGamma().getThresholdMultiplier());
    }

    /**
     * Detect gamma walls for one expiration.
     *
     * @param thresholdMultiplier minimum OI / median ratio, inclusive
     */
    public GammaWallsResult detectGammaWalls(OptionsExpiration expiration, double currentPrice,
                                             double thresholdMultiplier) {
        FairValueConfig.Gamma cfg = config.getGamma();
        double minStrike = currentPrice * cfg.getBandLow();
        double maxStrike = currentPrice * cfg.getBandHigh();

        Map<Double, StrikeAggregate> byStrike = new TreeMap<>();
        aggregate(expiration.getCallsOrEmpty(), minStrike, maxStrike, byStrike, true);
        aggregate(expiration.getPutsOrEmpty(), minStrike, maxStrike, byStrike, false);

        if (byStrike.isEmpty()) {
            log.debug("{} No strikes in band for {}", LOG_PREFIX, expiration.getExpiration());
            return GammaWallsResult.builder()
                    .walls(new ArrayList<>())
                    .center(currentPrice)
                    .build();
        }

        List<Long> callOIs = new ArrayList<>();
        List<Long> putOIs = new ArrayList<>();
        for (StrikeAggregate s : byStrike.values()) {
            if (s.callOI > 0) callOIs.add(s.callOI);
            if (s.putOI > 0) putOIs.add(s.putOI);
        }
        double medianCallOI = MathUtils.upperMedian(callOIs);
        double medianPutOI = MathUtils.upperMedian(putOIs);

        List<GammaWall> walls = new ArrayList<>();
        for (StrikeAggregate s : byStrike.values()) {
            double callStrength = MathUtils.safeDivide((double) s.callOI, medianCallOI, 0.0);
            double putStrength = MathUtils.safeDivide((double) s.putOI, medianPutOI, 0.0);
            boolean callSpike = callStrength >= thresholdMultiplier;
            boolean putSpike = putStrength >= thresholdMultiplier;

            if (callSpike && s.strike > currentPrice) {
                walls.add(GammaWall.builder()
                        .strike(s.strike)
                        .type(GammaWallType.CALL_WALL)
                        .openInterest(s.callOI)
                        .volume(s.callVolume)
                        .relativeStrength(callStrength)
                        .isSupport(false)
                        .isResistance(true)
                        .build());
            }

            if (putSpike && s.strike < currentPrice) {
                walls.add(GammaWall.builder()
                        .strike(s.strike)
                        .type(GammaWallType.PUT_WALL)
                        .openInterest(s.putOI)
                        .volume(s.putVolume)
                        .relativeStrength(putStrength)
                        .isSupport(true)
                        .isResistance(false)
                        .build());
            }

            if (callSpike && putSpike) {
                walls.add(GammaWall.builder()
                        .strike(s.strike)
                        .type(GammaWallType.COMBINED)
                        .openInterest(s.callOI + s.putOI)
                        .volume(s.callVolume + s.putVolume)
                        .relativeStrength((callStrength + putStrength) / 2)
                        .isSupport(s.strike < currentPrice)
                        .isResistance(s.strike > currentPrice)
                        .build());
            }
        }

        // Stable sort: equal strengths keep ascending-strike order
        walls.sort(Comparator.comparingDouble(GammaWall::getRelativeStrength).reversed());

        GammaWall strongestSupport = walls.stream().filter(GammaWall::isSupport).findFirst().orElse(null);
        GammaWall strongestResistance = walls.stream().filter(GammaWall::isResistance).findFirst().orElse(null);

        double center = calculateCenter(walls, currentPrice);

        log.debug("{} {}: strikes={}, medianCallOI={}, medianPutOI={}, walls={}, center={}",
                LOG_PREFIX, expiration.getExpiration(), byStrike.size(), medianCallOI, medianPutOI,
                walls.size(), String.format("%.2f", center));

        return GammaWallsResult.builder()
                .walls(walls)
                .strongestSupport(strongestSupport)
                .strongestResistance(strongestResistance)
                .center(center)
                .build();
    }

    /**
     * OI x strength weighted strike of all walls, currentPrice if none.
     */
    private double calculateCenter(List<GammaWall> walls, double currentPrice) {
        double[] strikes = new double[walls.size()];
        double[] weights = new double[walls.size()];
        for (int i = 0; i < walls.size(); i++) {
            GammaWall w = walls.get(i);
            strikes[i] = w.getStrike();
            weights[i] = w.getOpenInterest() * w.getRelativeStrength();
        }
        return MathUtils.weightedAverage(strikes, weights, currentPrice);
    }

    // ======================== GAMMA EXPOSURE ========================

    /**
     * Estimate per-strike gamma exposure: gamma x OI x 100 x spot.
     * Uses the contract's gamma when present, otherwise
     * 0.05 x exp(-10 x |spot - strike| / spot) x sqrt(dte / 365).
     *
     * @return one entry per strike, ascending; netGex = callGex - putGex
     */
    public List<GammaExposure> estimateGammaExposure(OptionsExpiration expiration, double currentPrice) {
        int multiplier = config.getMaxPain().getContractMultiplier();
        Map<Double, GammaExposure> byStrike = new TreeMap<>();

        for (OptionContract call : expiration.getCallsOrEmpty()) {
            if (call == null) continue;
            double gex = gammaOf(call, currentPrice, expiration.getDte()) * call.getOpenInterest() * multiplier * currentPrice;
            GammaExposure e = byStrike.computeIfAbsent(call.getStrike(), GammaWallDetector::emptyExposure);
            e.setCallGex(e.getCallGex() + gex);
            e.setNetGex(e.getCallGex() - e.getPutGex());
        }

        for (OptionContract put : expiration.getPutsOrEmpty()) {
            if (put == null) continue;
            double gex = gammaOf(put, currentPrice, expiration.getDte()) * put.getOpenInterest() * multiplier * currentPrice;
            GammaExposure e = byStrike.computeIfAbsent(put.getStrike(), GammaWallDetector::emptyExposure);
            e.setPutGex(e.getPutGex() + gex);
            e.setNetGex(e.getCallGex() - e.getPutGex());
        }

        return new ArrayList<>(byStrike.values());
    }

    /**
     * Price where net GEX changes sign, linearly interpolated between the first
     * pair of adjacent strikes whose net exposure has opposite signs.
     */
    public OptionalDouble findGammaFlip(List<GammaExposure> exposures) {
        if (exposures == null || exposures.size() < 2) {
            return OptionalDouble.empty();
        }
        List<GammaExposure> sorted = new ArrayList<>(exposures);
        sorted.sort(Comparator.comparingDouble(GammaExposure::getStrike));

        for (int i = 0; i < sorted.size() - 1; i++) {
            GammaExposure current = sorted.get(i);
            GammaExposure next = sorted.get(i + 1);
            boolean signChange = (current.getNetGex() > 0 && next.getNetGex() < 0)
                    || (current.getNetGex() < 0 && next.getNetGex() > 0);
            if (signChange) {
                double ratio = Math.abs(current.getNetGex())
                        / (Math.abs(current.getNetGex()) + Math.abs(next.getNetGex()));
                return OptionalDouble.of(current.getStrike() + ratio * (next.getStrike() - current.getStrike()));
            }
        }
        return OptionalDouble.empty();
    }

    static double estimateGamma(double strike, double spot, int dte) {
        double moneyness = MathUtils.safeDivide(Math.abs(spot - strike), spot, 0.0);
        double timeDecay = Math.sqrt(Math.max(0, dte) / 365.0);
        return PEAK_GAMMA * Math.exp(-moneyness * MONEYNESS_DECAY) * timeDecay;
    }

    private static double gammaOf(OptionContract contract, double spot, int dte) {
        Double gamma = contract.getGamma();
        if (gamma != null && gamma != 0 && MathUtils.isValidNumber(gamma)) {
            return gamma;
        }
        return estimateGamma(contract.getStrike(), spot, dte);
    }

    private static GammaExposure emptyExposure(double strike) {
        return GammaExposure.builder().strike(strike).build();
    }

    private static void aggregate(List<OptionContract> contracts, double minStrike, double maxStrike,
                                  Map<Double, StrikeAggregate> byStrike, boolean calls) {
        for (OptionContract c : contracts) {
            if (c == null || c.getOpenInterest() <= 0) continue;
            if (c.getStrike() < minStrike || c.getStrike() > maxStrike) continue;

            StrikeAggregate s = byStrike.computeIfAbsent(c.getStrike(), StrikeAggregate::new);
            if (calls) {
                s.callOI += c.getOpenInterest();
                s.callVolume += Math.max(0, c.getVolume());
            } else {
                s.putOI += c.getOpenInterest();
                s.putVolume += Math.max(0, c.getVolume());
            }
        }
    }

    private static class StrikeAggregate {
        final double strike;
        long callOI;
        long putOI;
        long callVolume;
        long putVolume;

        StrikeAggregate(double strike) {
            this.strike = strike;
        }
    }
}
