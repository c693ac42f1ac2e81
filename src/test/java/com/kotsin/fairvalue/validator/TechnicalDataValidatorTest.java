package com.kotsin.fairvalue.validator;

import com.kotsin.fairvalue.PfvFixtures;
import com.kotsin.fairvalue.fairvalue.model.FairValueInput;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TechnicalDataValidator")
class TechnicalDataValidatorTest {

    private static FairValueInput input(TechnicalData data) {
        return FairValueInput.builder().ticker("ACME").technicalData(data).build();
    }

    @Test
    @DisplayName("Complete snapshot passes")
    void testValid() {
        assertDoesNotThrow(() -> TechnicalDataValidator.validate(input(PfvFixtures.technicalData())));
    }

    @Test
    @DisplayName("Missing 52-week extremes are tolerated")
    void testMissingRangeTolerated() {
        TechnicalData data = TechnicalData.builder().currentPrice(50.0).build();
        assertDoesNotThrow(() -> TechnicalDataValidator.validate(input(data)));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Unusable current price is rejected")
    void testInvalidPrice(Double price) {
        TechnicalData data = TechnicalData.builder().currentPrice(price).build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TechnicalDataValidator.validate(input(data)));
        assertTrue(e.getMessage().contains("currentPrice"));
    }

    @Test
    @DisplayName("Null input, blank ticker and missing data are rejected")
    void testMissingPieces() {
        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate((FairValueInput) null));
        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate(
                FairValueInput.builder().ticker("  ").technicalData(PfvFixtures.technicalData()).build()));
        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate(input(null)));
    }

    @Test
    @DisplayName("Supplied 52-week extremes must be positive and ordered")
    void testRangeChecks() {
        TechnicalData inverted = TechnicalData.builder().currentPrice(50.0).fiftyTwoWeekHigh(40.0).fiftyTwoWeekLow(60.0).build();
        TechnicalData negativeLow = TechnicalData.builder().currentPrice(50.0).fiftyTwoWeekHigh(60.0).fiftyTwoWeekLow(-1.0).build();
        TechnicalData nanHigh = TechnicalData.builder().currentPrice(50.0).fiftyTwoWeekHigh(Double.NaN).build();

        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate(input(inverted)));
        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate(input(negativeLow)));
        assertThrows(IllegalArgumentException.class, () -> TechnicalDataValidator.validate(input(nanHigh)));
    }
}
