package com.kotsin.fairvalue.fairvalue.model;

import com.kotsin.fairvalue.options.model.OptionsExpiration;
import com.kotsin.fairvalue.profile.model.ProfileType;
import com.kotsin.fairvalue.technical.model.TechnicalData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FairValueInput {

    private String ticker;
    private TechnicalData technicalData;

    @Builder.Default
    private List<OptionsExpiration> expirations = new ArrayList<>();

    // Skips classification and heuristics when set
    private ProfileType profileOverride;
}
