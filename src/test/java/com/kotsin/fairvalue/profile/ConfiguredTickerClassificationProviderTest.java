package com.kotsin.fairvalue.profile;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.profile.model.ProfileType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfiguredTickerClassificationProvider")
class ConfiguredTickerClassificationProviderTest {

    @Test
    @DisplayName("Entries are trimmed and upper-cased, blanks and nulls skipped")
    void testNormalization() {
        FairValueConfig config = new FairValueConfig();
        config.getClassification().setEtf(Arrays.asList(" spy ", null, ""));
        config.getClassification().setMemeRetail(List.of("gme"));

        ConfiguredTickerClassificationProvider provider = new ConfiguredTickerClassificationProvider(config);

        assertEquals(Optional.of(ProfileType.ETF), provider.classify("SPY"));
        assertEquals(Optional.of(ProfileType.MEME_RETAIL), provider.classify(" Gme"));
        assertEquals(Optional.empty(), provider.classify("AAPL"));
    }

    @Test
    @DisplayName("Blank or null ticker is unclassified")
    void testBlankTicker() {
        ConfiguredTickerClassificationProvider provider = new ConfiguredTickerClassificationProvider(new FairValueConfig());
        assertTrue(provider.classify(null).isEmpty());
        assertTrue(provider.classify("  ").isEmpty());
    }
}
