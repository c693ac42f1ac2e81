package com.kotsin.fairvalue.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MathUtils")
class MathUtilsTest {

    // ========== WEIGHTED AVERAGE ==========

    @Test
    @DisplayName("Weighted average uses weights")
    void testWeightedAverage() {
        double result = MathUtils.weightedAverage(new double[]{100, 200}, new double[]{3, 1}, -1);
        assertEquals(125.0, result, 1e-9);
    }

    @Test
    @DisplayName("Weighted average falls back on empty input or zero weights")
    void testWeightedAverage_Fallback() {
        assertEquals(42.0, MathUtils.weightedAverage(new double[0], new double[0], 42.0));
        assertEquals(42.0, MathUtils.weightedAverage(new double[]{1, 2}, new double[]{0, 0}, 42.0));
        assertEquals(42.0, MathUtils.weightedAverage(new double[]{1, 2}, new double[]{1}, 42.0));
        assertEquals(42.0, MathUtils.weightedAverage((List<Double>) null, null, 42.0));
    }

    // ========== MEDIAN / DISPERSION ==========

    @Test
    @DisplayName("Upper median picks index n/2 of sorted values")
    void testUpperMedian() {
        assertEquals(300.0, MathUtils.upperMedian(List.of(400L, 100L, 300L, 200L)));
        assertEquals(200.0, MathUtils.upperMedian(List.of(300L, 100L, 200L)));
        assertEquals(0.0, MathUtils.upperMedian(List.of()));
    }

    @Test
    @DisplayName("Coefficient of variation is population std over mean")
    void testCoefficientOfVariation() {
        // mean 100, population std 10
        double cv = MathUtils.coefficientOfVariation(new double[]{90, 110});
        assertEquals(0.1, cv, 1e-12);
        assertEquals(0.0, MathUtils.coefficientOfVariation(new double[]{50, 50, 50}));
        assertEquals(0.0, MathUtils.coefficientOfVariation(new double[]{-1, 1}),
                "Zero mean reads as agreement");
    }

    // ========== ROUNDING ==========

    @Test
    @DisplayName("Prices round to cents, sub-$10 prices to tenths of a cent")
    void testRoundPrice() {
        assertEquals(188.61, MathUtils.roundPrice(188.6149));
        assertEquals(4.257, MathUtils.roundPrice(4.25749));
        assertTrue(Double.isNaN(MathUtils.roundPrice(Double.NaN)));
    }

    @Test
    @DisplayName("Percentages round to one decimal")
    void testRoundPercent() {
        assertEquals(2.3, MathUtils.roundPercent(2.34));
        assertEquals(-1.5, MathUtils.roundPercent(-1.46));
    }

    // ========== VALIDATION / CLAMP ==========

    @Test
    @DisplayName("isValidPositive rejects null, NaN, infinity and non-positive")
    void testIsValidPositive() {
        assertFalse(MathUtils.isValidPositive(null));
        assertFalse(MathUtils.isValidPositive(Double.NaN));
        assertFalse(MathUtils.isValidPositive(Double.POSITIVE_INFINITY));
        assertFalse(MathUtils.isValidPositive(0.0));
        assertFalse(MathUtils.isValidPositive(-3.0));
        assertTrue(MathUtils.isValidPositive(0.01));
    }

    @Test
    @DisplayName("clampUnit bounds to [0, 1] and maps NaN to 0")
    void testClampUnit() {
        assertEquals(1.0, MathUtils.clampUnit(1.7));
        assertEquals(0.0, MathUtils.clampUnit(-0.2));
        assertEquals(0.0, MathUtils.clampUnit(Double.NaN));
        assertEquals(0.5, MathUtils.clampUnit(0.5));
    }

    @Test
    @DisplayName("safeDivide returns default for zero denominator")
    void testSafeDivide() {
        assertEquals(-1.0, MathUtils.safeDivide(5, 0, -1.0));
        assertEquals(2.5, MathUtils.safeDivide(5, 2, -1.0));
    }
}
