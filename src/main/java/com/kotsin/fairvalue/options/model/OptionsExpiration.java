package com.kotsin.fairvalue.options.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Option chain snapshot for one expiration date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionsExpiration {

    private LocalDate expiration;
    private int dte;

    @Builder.Default
    private List<OptionContract> calls = new ArrayList<>();

    @Builder.Default
    private List<OptionContract> puts = new ArrayList<>();

    private long totalCallOI;
    private long totalPutOI;

    /**
     * Aggregate call + put open interest. Falls back to summing the contracts
     * when the feed left the aggregates at zero.
     */
    @JsonIgnore
    public long getTotalOI() {
        long aggregate = totalCallOI + totalPutOI;
        if (aggregate > 0) {
            return aggregate;
        }
        return sumOpenInterest(getCallsOrEmpty()) + sumOpenInterest(getPutsOrEmpty());
    }

    @JsonIgnore
    public List<OptionContract> getCallsOrEmpty() {
        return calls != null ? calls : Collections.emptyList();
    }

    @JsonIgnore
    public List<OptionContract> getPutsOrEmpty() {
        return puts != null ? puts : Collections.emptyList();
    }

    private static long sumOpenInterest(List<OptionContract> contracts) {
        long sum = 0;
        for (OptionContract c : contracts) {
            if (c != null && c.getOpenInterest() > 0) {
                sum += c.getOpenInterest();
            }
        }
        return sum;
    }
}
