package com.kotsin.fairvalue.options.service;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.options.calculator.GammaWallDetector;
import com.kotsin.fairvalue.options.calculator.MaxPainCalculator;
import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.options.model.ExpirationGroups;
import com.kotsin.fairvalue.options.model.GammaWall;
import com.kotsin.fairvalue.options.model.GammaWallType;
import com.kotsin.fairvalue.options.model.GammaWallsResult;
import com.kotsin.fairvalue.options.model.MaxPainResult;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.kotsin.fairvalue.PfvFixtures.expiration;
import static com.kotsin.fairvalue.PfvFixtures.flatChain;
import static com.kotsin.fairvalue.PfvFixtures.withSpike;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MultiExpirationAggregator")
class MultiExpirationAggregatorTest {

    private static final double PRICE = 100.0;

    // Wednesdays, so no opex multiplier applies
    private static final LocalDate NEAR = LocalDate.of(2026, 1, 14);
    private static final LocalDate FAR = LocalDate.of(2026, 2, 25);

    private FairValueConfig config;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        config = new FairValueConfig();
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private MultiExpirationAggregator aggregator() {
        return new MultiExpirationAggregator(config, new MaxPainCalculator(config), new GammaWallDetector(config), pool);
    }

    private static OptionsExpiration chain(LocalDate date, int dte, long oi) {
        return expiration(date, dte,
                withSpike(flatChain(85, 115, 5, oi), 110, oi * 5),
                withSpike(flatChain(85, 115, 5, oi), 90, oi * 4));
    }

    // ========== WEIGHTING ==========

    @Test
    @DisplayName("Weights sum to 1 and are sorted descending")
    void testWeightsNormalized() {
        List<ExpirationAnalysis> analyses = aggregator().analyzeMultipleExpirations(List.of(
                chain(FAR, 42, 1000),
                chain(NEAR, 0, 500),
                chain(LocalDate.of(2026, 1, 28), 14, 2000)), PRICE);

        assertEquals(3, analyses.size());
        double sum = analyses.stream().mapToDouble(ExpirationAnalysis::getWeight).sum();
        assertEquals(1.0, sum, 1e-9);
        for (int i = 1; i < analyses.size(); i++) {
            assertTrue(analyses.get(i - 1).getWeight() >= analyses.get(i).getWeight());
        }
    }

    @Test
    @DisplayName("With equal chains the nearer expiration weighs more")
    void testTimeDecay() {
        List<ExpirationAnalysis> analyses = aggregator().analyzeMultipleExpirations(List.of(
                chain(FAR, 42, 1000),
                chain(NEAR, 7, 1000)), PRICE);

        assertEquals(7, analyses.get(0).getDte());
        assertEquals(NEAR, aggregator().getPrimaryExpiration(analyses).orElseThrow().getExpiration());
    }

    @Test
    @DisplayName("Monthly opex outweighs an otherwise identical non-opex expiration")
    void testMonthlyOpexBoost() {
        // 2026-01-16 is the third Friday, 2026-01-14 a Wednesday
        List<ExpirationAnalysis> analyses = aggregator().analyzeMultipleExpirations(List.of(
                chain(NEAR, 10, 1000),
                chain(LocalDate.of(2026, 1, 16), 10, 1000)), PRICE);

        assertTrue(analyses.get(0).isMonthlyOpex());
        assertEquals(1.5, analyses.get(0).getWeight() / analyses.get(1).getWeight(), 1e-9);
    }

    // ========== DTE FILTER ==========

    @Test
    @DisplayName("Expirations outside the DTE window are dropped")
    void testDteFilter() {
        List<OptionsExpiration> expirations = List.of(
                chain(NEAR, 5, 1000),
                chain(FAR, 30, 1000),
                chain(LocalDate.of(2026, 4, 22), 90, 1000));

        assertEquals(2, aggregator().analyzeMultipleExpirations(expirations, PRICE).size());

        List<ExpirationAnalysis> narrowed = aggregator().analyzeMultipleExpirations(expirations, PRICE, 60, 10);
        assertEquals(1, narrowed.size());
        assertEquals(30, narrowed.get(0).getDte());
        assertEquals(1.0, narrowed.get(0).getWeight(), 1e-12);
    }

    @Test
    @DisplayName("Nothing to analyze yields empty analyses and fallback components")
    void testEmpty() {
        MultiExpirationAggregator aggregator = aggregator();
        List<ExpirationAnalysis> none = aggregator.analyzeMultipleExpirations(
                List.of(chain(NEAR, 120, 1000)), PRICE);

        assertTrue(none.isEmpty());
        assertTrue(aggregator.analyzeMultipleExpirations(null, PRICE).isEmpty());
        assertEquals(PRICE, aggregator.getWeightedMaxPain(none, PRICE));
        assertEquals(PRICE, aggregator.getWeightedGammaCenter(none, PRICE));
        assertTrue(aggregator.getPrimaryExpiration(none).isEmpty());
    }

    // ========== PARALLEL ==========

    @Test
    @DisplayName("Parallel analysis matches sequential analysis")
    void testParallelMatchesSequential() {
        List<OptionsExpiration> expirations = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            expirations.add(chain(NEAR.plusDays(7L * i), 7 * i, 500 + 250L * i));
        }

        List<ExpirationAnalysis> sequential = aggregator().analyzeMultipleExpirations(expirations, PRICE);

        config.getExpiration().setParallel(true);
        List<ExpirationAnalysis> parallel = aggregator().analyzeMultipleExpirations(expirations, PRICE);

        assertEquals(sequential, parallel);
    }

    // ========== GROUPING / WALL AGGREGATION ==========

    @Test
    @DisplayName("Expirations are grouped into monthly, weekly and other")
    void testGrouping() {
        List<ExpirationAnalysis> analyses = aggregator().analyzeMultipleExpirations(List.of(
                chain(LocalDate.of(2026, 1, 16), 10, 1000),
                chain(LocalDate.of(2026, 1, 9), 3, 1000),
                chain(LocalDate.of(2026, 1, 15), 9, 1000)), PRICE);

        ExpirationGroups groups = aggregator().getExpirationsByType(analyses);

        assertEquals(1, groups.getMonthly().size());
        assertEquals(1, groups.getWeekly().size());
        assertEquals(1, groups.getOther().size());
        assertEquals(LocalDate.of(2026, 1, 15), groups.getOther().get(0).getExpiration());
    }

    @Test
    @DisplayName("A call wall and a put wall on the same strike merge into COMBINED")
    void testAggregateGammaWalls() {
        ExpirationAnalysis first = analysisWithWalls(0.75, GammaWall.builder()
                .strike(110).type(GammaWallType.CALL_WALL).openInterest(4000).relativeStrength(4)
                .isResistance(true).build());
        ExpirationAnalysis second = analysisWithWalls(0.25, GammaWall.builder()
                .strike(110).type(GammaWallType.PUT_WALL).openInterest(8000).relativeStrength(8)
                .isSupport(true).build(),
                GammaWall.builder()
                .strike(95).type(GammaWallType.PUT_WALL).openInterest(2000).relativeStrength(2)
                .isSupport(true).build());

        GammaWallsResult merged = aggregator().aggregateGammaWalls(List.of(first, second));

        assertEquals(2, merged.getWalls().size());
        GammaWall at110 = merged.getWalls().get(0);
        assertEquals(110.0, at110.getStrike());
        assertEquals(GammaWallType.COMBINED, at110.getType());
        // (4 x 0.75 + 8 x 0.25) / 1.0
        assertEquals(5.0, at110.getRelativeStrength(), 1e-9);
        assertEquals(5000, at110.getOpenInterest());
        assertTrue(at110.isSupport());
        assertTrue(at110.isResistance());
        assertEquals(110.0, merged.getStrongestSupport().getStrike());
        assertEquals(95.0, merged.getWalls().get(1).getStrike());
        assertEquals(GammaWallType.PUT_WALL, merged.getWalls().get(1).getType());
        assertEquals(0.0, aggregator().aggregateGammaWalls(List.of()).getCenter());
    }

    private static ExpirationAnalysis analysisWithWalls(double weight, GammaWall... walls) {
        return ExpirationAnalysis.builder()
                .expiration(NEAR)
                .dte(7)
                .weight(weight)
                .maxPain(MaxPainResult.builder().price(PRICE).build())
                .gammaWalls(GammaWallsResult.builder().walls(new ArrayList<>(List.of(walls))).center(PRICE).build())
                .build();
    }

    @Test
    @DisplayName("Weighted max pain blends pins by weight")
    void testWeightedMaxPain() {
        ExpirationAnalysis a = analysisWithWalls(0.75).toBuilder()
                .maxPain(MaxPainResult.builder().price(100).build()).build();
        ExpirationAnalysis b = analysisWithWalls(0.25).toBuilder()
                .maxPain(MaxPainResult.builder().price(120).build()).build();

        assertEquals(105.0, aggregator().getWeightedMaxPain(List.of(a, b), 0), 1e-9);
    }
}
