package com.kotsin.fairvalue.options.calculator;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.options.model.GammaExposure;
import com.kotsin.fairvalue.options.model.GammaWall;
import com.kotsin.fairvalue.options.model.GammaWallType;
import com.kotsin.fairvalue.options.model.GammaWallsResult;
import com.kotsin.fairvalue.options.model.OptionContract;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static com.kotsin.fairvalue.PfvFixtures.contract;
import static com.kotsin.fairvalue.PfvFixtures.expiration;
import static com.kotsin.fairvalue.PfvFixtures.flatChain;
import static com.kotsin.fairvalue.PfvFixtures.withSpike;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GammaWallDetector")
class GammaWallDetectorTest {

    private static final LocalDate EXPIRY = LocalDate.of(2026, 11, 20);

    private GammaWallDetector detector;

    @BeforeEach
    void setUp() {
        detector = new GammaWallDetector(new FairValueConfig());
    }

    // ========== THRESHOLD ==========

    @Test
    @DisplayName("OI exactly 2x the median is a wall")
    void testThresholdInclusive() {
        List<OptionContract> calls = withSpike(flatChain(110, 130, 5, 100), 120, 200);
        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, calls, List.of()), 100);

        assertEquals(1, result.getWalls().size());
        GammaWall wall = result.getWalls().get(0);
        assertEquals(120.0, wall.getStrike());
        assertEquals(GammaWallType.CALL_WALL, wall.getType());
        assertEquals(2.0, wall.getRelativeStrength(), 1e-12);
        assertTrue(wall.isResistance());
        assertFalse(wall.isSupport());
        assertSame(wall, result.getStrongestResistance());
        assertNull(result.getStrongestSupport());
    }

    @Test
    @DisplayName("OI just under 2x the median is not a wall")
    void testThresholdJustBelow() {
        List<OptionContract> calls = withSpike(flatChain(110, 130, 5, 100), 120, 199);
        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, calls, List.of()), 100);

        assertTrue(result.getWalls().isEmpty());
        assertEquals(100.0, result.getCenter(), "No walls centers on spot");
    }

    @Test
    @DisplayName("Put spike below price is support, call spike below price is not a call wall")
    void testSidesRespectPrice() {
        List<OptionContract> puts = withSpike(flatChain(85, 105, 5, 100), 90, 500);
        List<OptionContract> calls = withSpike(flatChain(85, 105, 5, 100), 90, 500);
        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, calls, puts), 100);

        List<GammaWallType> types = result.getWalls().stream().map(GammaWall::getType).collect(Collectors.toList());
        assertFalse(types.contains(GammaWallType.CALL_WALL));
        assertTrue(types.contains(GammaWallType.PUT_WALL));
        assertEquals(90.0, result.getStrongestSupport().getStrike());
    }

    @Test
    @DisplayName("Custom threshold overrides configuration")
    void testCustomThreshold() {
        List<OptionContract> calls = withSpike(flatChain(110, 130, 5, 100), 120, 150);
        OptionsExpiration exp = expiration(EXPIRY, 30, calls, List.of());

        assertTrue(detector.detectGammaWalls(exp, 100).getWalls().isEmpty());
        assertEquals(1, detector.detectGammaWalls(exp, 100, 1.5).getWalls().size());
    }

    // ========== COMBINED WALLS ==========

    @Test
    @DisplayName("Both sides spiking emits a side wall and a COMBINED wall at the same strike")
    void testCombinedWallDoubleCounts() {
        List<OptionContract> calls = withSpike(flatChain(90, 110, 5, 100), 95, 300);
        List<OptionContract> puts = withSpike(flatChain(90, 110, 5, 100), 95, 300);
        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, calls, puts), 100);

        List<GammaWall> at95 = result.getWalls().stream()
                .filter(w -> w.getStrike() == 95.0)
                .collect(Collectors.toList());
        assertEquals(2, at95.size(), "Strike is counted once as PUT_WALL and once as COMBINED");
        assertEquals(GammaWallType.PUT_WALL, at95.get(0).getType(), "Equal strengths keep insertion order");
        assertEquals(GammaWallType.COMBINED, at95.get(1).getType());
        assertEquals(600, at95.get(1).getOpenInterest());
        assertEquals(3.0, at95.get(1).getRelativeStrength(), 1e-12);
        assertTrue(at95.get(1).isSupport());
        assertEquals(95.0, result.getCenter(), 1e-9);
    }

    @Test
    @DisplayName("Walls are sorted by strength and the center is OI x strength weighted")
    void testSortingAndCenter() {
        List<OptionContract> calls = flatChain(170, 205, 5, 1000);
        calls = withSpike(calls, 195, 20_000);
        List<OptionContract> puts = withSpike(flatChain(170, 205, 5, 1000), 180, 20_000);
        puts = withSpike(puts, 175, 4000);

        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, calls, puts), 188.61);

        for (int i = 1; i < result.getWalls().size(); i++) {
            assertTrue(result.getWalls().get(i - 1).getRelativeStrength() >= result.getWalls().get(i).getRelativeStrength());
        }
        assertEquals(180.0, result.getStrongestSupport().getStrike());
        assertEquals(195.0, result.getStrongestResistance().getStrike());
        // 180 x 20k x 20 + 195 x 20k x 20 + 175 x 4k x 4
        double expected = (180 * 400_000.0 + 195 * 400_000.0 + 175 * 16_000.0) / 816_000.0;
        assertEquals(expected, result.getCenter(), 1e-9);
    }

    @Test
    @DisplayName("Empty chain centers on spot")
    void testEmptyChain() {
        GammaWallsResult result = detector.detectGammaWalls(expiration(EXPIRY, 30, List.of(), List.of()), 42);

        assertTrue(result.getWalls().isEmpty());
        assertEquals(42.0, result.getCenter());
    }

    // ========== GAMMA EXPOSURE ==========

    @Test
    @DisplayName("Contract gamma is used when present")
    void testExposureWithContractGamma() {
        OptionContract call = OptionContract.builder().strike(100).openInterest(10).gamma(0.02).build();
        OptionContract put = OptionContract.builder().strike(100).openInterest(10).gamma(0.01).build();

        List<GammaExposure> exposures = detector.estimateGammaExposure(
                expiration(EXPIRY, 30, List.of(call), List.of(put)), 100);

        assertEquals(1, exposures.size());
        assertEquals(2000.0, exposures.get(0).getCallGex(), 1e-9);
        assertEquals(1000.0, exposures.get(0).getPutGex(), 1e-9);
        assertEquals(1000.0, exposures.get(0).getNetGex(), 1e-9);
    }

    @Test
    @DisplayName("Gamma approximation peaks at the money")
    void testEstimateGamma() {
        assertEquals(0.05, GammaWallDetector.estimateGamma(100, 100, 365), 1e-12);
        assertTrue(GammaWallDetector.estimateGamma(120, 100, 365) < GammaWallDetector.estimateGamma(105, 100, 365));
        assertEquals(0.0, GammaWallDetector.estimateGamma(100, 100, 0));
    }

    @Test
    @DisplayName("Exposures come back in ascending strike order")
    void testExposureOrdering() {
        List<GammaExposure> exposures = detector.estimateGammaExposure(
                expiration(EXPIRY, 30, List.of(contract(110, 10), contract(90, 10)), List.of(contract(100, 10))), 100);

        assertEquals(List.of(90.0, 100.0, 110.0),
                exposures.stream().map(GammaExposure::getStrike).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Gamma flip interpolates the first sign change")
    void testGammaFlip() {
        List<GammaExposure> exposures = List.of(
                GammaExposure.builder().strike(100).netGex(-300).build(),
                GammaExposure.builder().strike(90).netGex(100).build(),
                GammaExposure.builder().strike(110).netGex(-50).build());

        OptionalDouble flip = detector.findGammaFlip(exposures);

        assertTrue(flip.isPresent());
        assertEquals(92.5, flip.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("No sign change means no flip")
    void testNoGammaFlip() {
        List<GammaExposure> exposures = List.of(
                GammaExposure.builder().strike(90).netGex(100).build(),
                GammaExposure.builder().strike(100).netGex(50).build());

        assertTrue(detector.findGammaFlip(exposures).isEmpty());
        assertTrue(detector.findGammaFlip(List.of()).isEmpty());
    }
}
