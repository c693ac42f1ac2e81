package com.kotsin.fairvalue.options.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.options.model.MaxPainResult;
import com.kotsin.fairvalue.options.model.OptionContract;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * MaxPainCalculator - Strike at which option writers pay out the least at expiration.
 *
 * Every in-band strike is tried as a settlement price:
 *   pain(S) = sum over calls below S of (S - K) * OI * multiplier
 *           + sum over puts above S of (K - S) * OI * multiplier
 * The lowest pain wins; ties keep the lowest strike.
 *
 * Only strikes inside [bandLow x spot, bandHigh x spot] with positive OI are used,
 * which keeps deep LEAPS and pre-split strikes from dominating the sum.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MaxPainCalculator {

    private static final String LOG_PREFIX = "[MAX-PAIN]";

    private final FairValueConfig config;

    /**
     * Calculate max pain for one expiration.
     *
     * @param expiration   option chain for one expiration date
     * @param currentPrice spot price
     * @return result with confidence 0 and price = currentPrice when no strike survives the band filter
     */
    public MaxPainResult calculateMaxPain(OptionsExpiration expiration, double currentPrice) {
        FairValueConfig.MaxPain cfg = config.getMaxPain();
        double minStrike = currentPrice * cfg.getBandLow();
        double maxStrike = currentPrice * cfg.getBandHigh();

        Map<Double, Long> callOI = aggregateInBand(expiration.getCallsOrEmpty(), minStrike, maxStrike);
        Map<Double, Long> putOI = aggregateInBand(expiration.getPutsOrEmpty(), minStrike, maxStrike);

        TreeSet<Double> strikes = new TreeSet<>();
        strikes.addAll(callOI.keySet());
        strikes.addAll(putOI.keySet());

        if (strikes.isEmpty()) {
            log.warn("{} No strikes with OI in band [{}, {}] for {}, falling back to spot",
                    LOG_PREFIX, String.format("%.2f", minStrike), String.format("%.2f", maxStrike),
                    expiration.getExpiration());
            return MaxPainResult.builder()
                    .price(currentPrice)
                    .expiration(expiration.getExpiration())
                    .dte(expiration.getDte())
                    .totalPainAtMaxPain(0)
                    .callPain(0)
                    .putPain(0)
                    .confidence(0)
                    .build();
        }

        int multiplier = cfg.getContractMultiplier();
        double minPain = Double.POSITIVE_INFINITY;
        double maxPainStrike = currentPrice;
        double bestCallPain = 0;
        double bestPutPain = 0;

        // Strikes iterate ascending, strict < keeps the first minimum
        for (double testPrice : strikes) {
            double callPain = 0;
            double putPain = 0;

            for (Map.Entry<Double, Long> e : callOI.entrySet()) {
                if (e.getKey() < testPrice) {
                    callPain += (testPrice - e.getKey()) * e.getValue() * multiplier;
                }
            }
            for (Map.Entry<Double, Long> e : putOI.entrySet()) {
                if (e.getKey() > testPrice) {
                    putPain += (e.getKey() - testPrice) * e.getValue() * multiplier;
                }
            }

            double totalPain = callPain + putPain;
            if (totalPain < minPain) {
                minPain = totalPain;
                maxPainStrike = testPrice;
                bestCallPain = callPain;
                bestPutPain = putPain;
            }
        }

        double confidence = calculateConfidence(callOI, putOI, maxPainStrike, strikes.size());

        log.debug("{} {} dte={}: strikes={}, maxPain={}, pain={}, confidence={}",
                LOG_PREFIX, expiration.getExpiration(), expiration.getDte(), strikes.size(),
                maxPainStrike, String.format("%.0f", minPain), String.format("%.3f", confidence));

        return MaxPainResult.builder()
                .price(maxPainStrike)
                .expiration(expiration.getExpiration())
                .dte(expiration.getDte())
                .totalPainAtMaxPain(minPain)
                .callPain(bestCallPain)
                .putPain(bestPutPain)
                .confidence(confidence)
                .build();
    }

    /**
     * Confidence = OI magnitude (cap 0.4) + OI concentration near the pin (cap 0.3)
     *            + strike density (cap 0.3), clamped to [0, 1].
     */
    private double calculateConfidence(Map<Double, Long> callOI, Map<Double, Long> putOI,
                                       double maxPainStrike, int strikeCount) {
        FairValueConfig.MaxPain cfg = config.getMaxPain();

        long totalOI = sum(callOI) + sum(putOI);
        if (totalOI == 0) {
            return 0;
        }

        double oiFactor = Math.min(cfg.getOiFactorCap(), totalOI / cfg.getOiCap());

        double range = maxPainStrike * cfg.getConcentrationRange();
        long nearbyOI = sumWithin(callOI, maxPainStrike, range) + sumWithin(putOI, maxPainStrike, range);
        double concentrationFactor = Math.min(cfg.getConcentrationFactorCap(),
                MathUtils.safeDivide((double) nearbyOI, (double) totalOI, 0.0) * cfg.getConcentrationScale());

        double densityFactor = Math.min(cfg.getDensityCap(),
                MathUtils.safeDivide(strikeCount, cfg.getDensityStrikes(), 0.0));

        return MathUtils.clampUnit(oiFactor + concentrationFactor + densityFactor);
    }

    private static Map<Double, Long> aggregateInBand(List<OptionContract> contracts, double minStrike, double maxStrike) {
        Map<Double, Long> oiByStrike = new TreeMap<>();
        for (OptionContract c : contracts) {
            if (c == null || c.getOpenInterest() <= 0) {
                continue;
            }
            if (c.getStrike() >= minStrike && c.getStrike() <= maxStrike) {
                oiByStrike.merge(c.getStrike(), c.getOpenInterest(), Long::sum);
            }
        }
        return oiByStrike;
    }

    private static long sum(Map<Double, Long> oiByStrike) {
        long total = 0;
        for (long oi : oiByStrike.values()) {
            total += oi;
        }
        return total;
    }

    private static long sumWithin(Map<Double, Long> oiByStrike, double center, double range) {
        long total = 0;
        for (Map.Entry<Double, Long> e : oiByStrike.entrySet()) {
            if (Math.abs(e.getKey() - center) <= range) {
                total += e.getValue();
            }
        }
        return total;
    }
}
