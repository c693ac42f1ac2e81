package com.kotsin.fairvalue.technical.analyzer;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.fairvalue.model.BiasSentiment;
import com.kotsin.fairvalue.technical.model.RoundNumberLevel;
import com.kotsin.fairvalue.technical.model.RoundNumberSignificance;
import com.kotsin.fairvalue.technical.model.RoundNumbersResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoundNumberAnalyzer")
class RoundNumberAnalyzerTest {

    private RoundNumberAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RoundNumberAnalyzer(new FairValueConfig());
    }

    // ========== INTERVAL TIERS ==========

    @ParameterizedTest
    @CsvSource({
            "750, 100",
            "500, 100",
            "188.61, 50",
            "55, 25",
            "20, 10",
            "12, 5",
            "5, 1"
    })
    @DisplayName("Major interval follows the price tier")
    void testMajorInterval(double price, double expectedMajor) {
        assertEquals(expectedMajor, RoundNumberAnalyzer.intervalsFor(price).get(0).getInterval());
        assertEquals(RoundNumberSignificance.MAJOR, RoundNumberAnalyzer.intervalsFor(price).get(0).getSignificance());
    }

    // ========== LEVEL GENERATION ==========

    @Test
    @DisplayName("Levels stay within the +/-20% band, are unique and sorted by pull")
    void testLevelsWithinBand() {
        double price = 188.61;
        RoundNumbersResult result = analyzer.analyzeRoundNumbers(price);
        List<RoundNumberLevel> levels = result.getLevels();

        assertFalse(levels.isEmpty());
        for (RoundNumberLevel level : levels) {
            assertTrue(level.getPrice() >= price * 0.8 && level.getPrice() <= price * 1.2);
            assertTrue(level.getMagneticPull() > 0 && level.getMagneticPull() <= 1.0);
        }
        List<Double> prices = levels.stream().map(RoundNumberLevel::getPrice).collect(Collectors.toList());
        assertEquals(prices.size(), prices.stream().distinct().count());
        for (int i = 1; i < levels.size(); i++) {
            assertTrue(levels.get(i - 1).getMagneticPull() >= levels.get(i).getMagneticPull());
        }
    }

    @Test
    @DisplayName("Shared multiples keep the highest significance")
    void testDeduplicationKeepsMajor() {
        RoundNumbersResult result = analyzer.analyzeRoundNumbers(188.61);

        RoundNumberLevel at200 = result.getLevels().stream()
                .filter(l -> l.getPrice() == 200.0)
                .findFirst()
                .orElseThrow();
        assertEquals(RoundNumberSignificance.MAJOR, at200.getSignificance());
        assertEquals(200.0, result.getNearestMajor().getPrice());
        // (1.0 + 0.2 bonus) x exp(-5 x 0.0604), capped at 1
        assertEquals(0.8873, at200.getMagneticPull(), 1e-3);
        assertEquals(RoundNumberSignificance.MODERATE, result.getLevels().stream()
                .filter(l -> l.getPrice() == 175.0).findFirst().orElseThrow().getSignificance());
    }

    @Test
    @DisplayName("Narrow band changes the candidate set")
    void testCustomBand() {
        RoundNumbersResult narrow = analyzer.analyzeRoundNumbers(188.61, 0.02);

        assertEquals(List.of(190.0), narrow.getLevels().stream().map(RoundNumberLevel::getPrice).collect(Collectors.toList()));
        assertNull(narrow.getNearestMajor());
        assertEquals(190.0, narrow.getMagneticCenter(), 1e-9);
    }

    @Test
    @DisplayName("Sub-dollar tiers do not accumulate drift")
    void testSmallPrice() {
        RoundNumbersResult result = analyzer.analyzeRoundNumbers(5.0);

        assertTrue(result.getLevels().stream().anyMatch(l -> l.getPrice() == 5.0
                && l.getSignificance() == RoundNumberSignificance.MAJOR));
        assertTrue(result.getLevels().stream().anyMatch(l -> l.getPrice() == 4.25));
    }

    // ========== MAGNET QUERIES ==========

    @Test
    @DisplayName("Strongest magnet within 5%")
    void testFindStrongestMagnet() {
        Optional<RoundNumberLevel> magnet = analyzer.findStrongestMagnet(188.61);

        assertTrue(magnet.isPresent());
        assertEquals(190.0, magnet.get().getPrice());
    }

    @Test
    @DisplayName("At round number within 0.5%")
    void testIsAtRoundNumber() {
        assertTrue(analyzer.isAtRoundNumber(200.5).isPresent());
        assertTrue(analyzer.isAtRoundNumber(188.61).isEmpty());
        assertEquals(190.0, analyzer.isAtRoundNumber(188.61, 1.0).orElseThrow().getPrice());
    }

    @Test
    @DisplayName("Midpoints sit halfway between majors around the price")
    void testMidpointLevels() {
        assertEquals(List.of(75.0, 125.0, 175.0, 225.0, 275.0), analyzer.getMidpointLevels(188.61));
        assertEquals(List.of(2.5, 3.5, 4.5, 5.5, 6.5), analyzer.getMidpointLevels(4.2));
    }

    @Test
    @DisplayName("Just above a major is bullish, just below is bearish")
    void testRoundNumberBias() {
        assertEquals(BiasSentiment.BULLISH, analyzer.getRoundNumberBias(201));
        assertEquals(BiasSentiment.BEARISH, analyzer.getRoundNumberBias(199));
        assertEquals(BiasSentiment.NEUTRAL, analyzer.getRoundNumberBias(225));
    }
}
