package com.kotsin.fairvalue.validator;

import com.kotsin.fairvalue.fairvalue.model.FairValueInput;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import com.kotsin.fairvalue.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * TechnicalDataValidator - Hard preconditions for a fair value calculation.
 *
 * The only fatal problem is a missing price anchor. Everything else degrades:
 * - ticker present and non-blank
 * - currentPrice present, finite and &gt; 0
 * - 52-week high/low, when supplied, finite and &gt; 0 with low &lt;= high
 *
 * Absent 52-week extremes are allowed and only logged.
 */
@Slf4j
public final class TechnicalDataValidator {

    private static final String LOG_PREFIX = "[PFV-VALIDATION]";

    private TechnicalDataValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws IllegalArgumentException when the input cannot anchor a calculation
     */
    public static void validate(FairValueInput input) {
        if (input == null) {
            throw new IllegalArgumentException("Fair value input is required");
        }
        if (input.getTicker() == null || input.getTicker().isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        validate(input.getTicker(), input.getTechnicalData());
    }

    public static void validate(String ticker, TechnicalData data) {
        if (data == null) {
            throw new IllegalArgumentException("Technical data is required for " + ticker);
        }
        if (!MathUtils.isValidPositive(data.getCurrentPrice())) {
            throw new IllegalArgumentException(
                    "currentPrice must be a positive number for " + ticker + " (was " + data.getCurrentPrice() + ")");
        }

        Double high = data.getFiftyTwoWeekHigh();
        Double low = data.getFiftyTwoWeekLow();

        if (high != null && !MathUtils.isValidPositive(high)) {
            throw new IllegalArgumentException("fiftyTwoWeekHigh must be a positive number for " + ticker + " (was " + high + ")");
        }
        if (low != null && !MathUtils.isValidPositive(low)) {
            throw new IllegalArgumentException("fiftyTwoWeekLow must be a positive number for " + ticker + " (was " + low + ")");
        }
        if (high != null && low != null && low > high) {
            throw new IllegalArgumentException(
                    "fiftyTwoWeekLow " + low + " is above fiftyTwoWeekHigh " + high + " for " + ticker);
        }

        if (high == null || low == null) {
            log.warn("{} {} has no complete 52-week range, those levels are omitted", LOG_PREFIX, ticker);
        }
    }
}
