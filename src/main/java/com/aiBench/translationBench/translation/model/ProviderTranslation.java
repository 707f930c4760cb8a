package com.aiBench.translationBench.translation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw answer of a translation backend.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProviderTranslation {

    private String outputText;

    /**
     * Total tokens billed, when the backend reports them.
     */
    private Integer usageTokens;

    /**
     * Model that actually served the request, when the backend reports it.
     */
    private String model;
}
