package com.kotsin.fairvalue;

import com.kotsin.fairvalue.options.model.OptionContract;
import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.technical.model.TechnicalData;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for option chains and technical snapshots used across tests.
 */
public final class PfvFixtures {

    private PfvFixtures() {
    }

    public static OptionContract contract(double strike, long openInterest) {
        return OptionContract.builder()
                .strike(strike)
                .openInterest(openInterest)
                .volume(openInterest / 10)
                .build();
    }

    public static OptionsExpiration expiration(LocalDate date, int dte,
                                               List<OptionContract> calls, List<OptionContract> puts) {
        return OptionsExpiration.builder()
                .expiration(date)
                .dte(dte)
                .calls(new ArrayList<>(calls))
                .puts(new ArrayList<>(puts))
                .build();
    }

    /**
     * Chain with flat OI on every strike in [from, to] stepping by step.
     */
    public static List<OptionContract> flatChain(double from, double to, double step, long oi) {
        List<OptionContract> contracts = new ArrayList<>();
        for (double k = from; k <= to + 1e-9; k += step) {
            contracts.add(contract(k, oi));
        }
        return contracts;
    }

    /**
     * Replace the OI of the contract at strike, or append one.
     */
    public static List<OptionContract> withSpike(List<OptionContract> contracts, double strike, long oi) {
        List<OptionContract> out = new ArrayList<>();
        boolean replaced = false;
        for (OptionContract c : contracts) {
            if (c.getStrike() == strike) {
                out.add(contract(strike, oi));
                replaced = true;
            } else {
                out.add(c);
            }
        }
        if (!replaced) {
            out.add(contract(strike, oi));
        }
        return out;
    }

    /**
     * Mid-cap style snapshot at 188.61 with a full set of levels and no VWAP.
     */
    public static TechnicalData technicalData() {
        return TechnicalData.builder()
                .currentPrice(188.61)
                .ma20(186.0)
                .ma50(182.0)
                .ma200(175.0)
                .fiftyTwoWeekHigh(199.62)
                .fiftyTwoWeekLow(164.08)
                .build();
    }

    /**
     * One 30-DTE expiration on strikes 170-205: flat 1000 OI with a 20000 put spike at 180
     * and a 20000 call spike at 195. Aggregates set to 27000 per side.
     */
    public static OptionsExpiration spikedExpiration(LocalDate date) {
        List<OptionContract> calls = withSpike(flatChain(170, 205, 5, 1000), 195, 20_000);
        List<OptionContract> puts = withSpike(flatChain(170, 205, 5, 1000), 180, 20_000);
        OptionsExpiration exp = expiration(date, 30, calls, puts);
        exp.setTotalCallOI(27_000);
        exp.setTotalPutOI(27_000);
        return exp;
    }
}
