package com.kotsin.fairvalue.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MathUtils - Safe mathematical operations with NaN/Infinity/Division-by-zero protection
 *
 * Every weighted center in the engine (technical, round-number, gamma, multi-expiration)
 * goes through {@link #weightedAverage(double[], double[], double)} so the empty-input
 * and zero-weight fallbacks behave the same way everywhere.
 *
 * USAGE:
 * Instead of: double result = a / b;
 * Use: double result = MathUtils.safeDivide(a, b, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // Epsilon for floating point comparisons
    private static final double EPSILON = 1e-10;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     *
     * @param numerator   The numerator
     * @param denominator The denominator
     * @param defaultValue Value to return if division is unsafe
     * @return Result of division or defaultValue
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    /**
     * Check if a number is valid for use as a denominator
     */
    public static boolean isValidDenominator(double value) {
        return value != 0 && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== NUMBER VALIDATION ========================

    /**
     * Check if a number is valid (not NaN, not Infinite)
     */
    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Check if a Double wrapper is valid (not null, not NaN, not Infinite)
     */
    public static boolean isValidNumber(Double value) {
        return value != null && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Check if a Double wrapper is present, finite and strictly positive.
     * Optional price fields (moving averages, swings, VWAP) are only used when this holds.
     */
    public static boolean isValidPositive(Double value) {
        return isValidNumber(value) && value > 0;
    }

    // ======================== PERCENTAGE CALCULATIONS ========================

    /**
     * Safe percentage change: ((new - old) / old) * 100
     */
    public static double safePercentageChange(double newValue, double oldValue, double defaultValue) {
        if (!isValidDenominator(oldValue)) {
            return defaultValue;
        }
        double change = (newValue - oldValue) / oldValue * 100.0;
        return isValidNumber(change) ? change : defaultValue;
    }

    // ======================== WEIGHTED AVERAGES ========================

    /**
     * Weighted average of values. Returns fallback when the arrays are empty,
     * of different length, or the weights sum to zero.
     */
    public static double weightedAverage(double[] values, double[] weights, double fallback) {
        if (values == null || weights == null || values.length == 0 || values.length != weights.length) {
            return fallback;
        }
        double weightedSum = 0;
        double totalWeight = 0;
        for (int i = 0; i < values.length; i++) {
            weightedSum += values[i] * weights[i];
            totalWeight += weights[i];
        }
        if (Math.abs(totalWeight) < EPSILON) {
            return fallback;
        }
        return safeDivide(weightedSum, totalWeight, fallback);
    }

    /**
     * Convenience overload for boxed lists.
     */
    public static double weightedAverage(List<Double> values, List<Double> weights, double fallback) {
        if (values == null || weights == null) {
            return fallback;
        }
        return weightedAverage(toArray(values), toArray(weights), fallback);
    }

    // ======================== DISTRIBUTION STATS ========================

    /**
     * Median as used for open-interest baselines: element at index floor(n/2)
     * of the ascending-sorted values (upper median for even counts).
     * Returns 0 for an empty list.
     */
    public static double upperMedian(List<Long> values) {
        if (values == null || values.isEmpty()) {
            return 0;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation, 0 for fewer than two values.
     */
    public static double populationStdDev(double[] values) {
        if (values == null || values.length < 2) {
            return 0;
        }
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        double result = Math.sqrt(sumSq / values.length);
        return isValidNumber(result) ? result : 0;
    }

    /**
     * Coefficient of variation (population stddev / mean).
     * Returns 0 when the mean is zero so identical or empty inputs read as full agreement.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        return Math.abs(safeDivide(populationStdDev(values), mean, 0.0));
    }

    // ======================== ROUNDING ========================

    /**
     * Round a price for presentation: cents, or tenths of a cent below $10.
     */
    public static double roundPrice(double price) {
        if (!isValidNumber(price)) {
            return price;
        }
        if (Math.abs(price) < 10) {
            return Math.round(price * 1000.0) / 1000.0;
        }
        return Math.round(price * 100.0) / 100.0;
    }

    /**
     * Round a percentage to one decimal.
     */
    public static double roundPercent(double percent) {
        if (!isValidNumber(percent)) {
            return percent;
        }
        return Math.round(percent * 10.0) / 10.0;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    // ======================== FLOATING POINT COMPARISON ========================

    /**
     * Safe floating point equality comparison
     */
    public static boolean equals(double a, double b) {
        return Math.abs(a - b) < EPSILON;
    }

    /**
     * Safe floating point comparison with custom epsilon
     */
    public static boolean equals(double a, double b, double epsilon) {
        return Math.abs(a - b) < epsilon;
    }

    // ======================== CLAMPING ========================

    /**
     * Clamp value to range [min, max]
     */
    public static double clamp(double value, double min, double max) {
        if (!isValidNumber(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp a score or confidence to [0, 1]
     */
    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            out[i] = v != null ? v : 0.0;
        }
        return out;
    }
}
