package com.kotsin.fairvalue.dto;

import com.kotsin.fairvalue.fairvalue.model.FairValueInput;
import com.kotsin.fairvalue.fairvalue.model.FairValueOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/fair-value}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FairValueRequest {

    private FairValueInput input;

    // Optional, defaults apply when absent
    private FairValueOptions options;
}
