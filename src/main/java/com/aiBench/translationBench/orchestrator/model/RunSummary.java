package com.aiBench.translationBench.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RunSummary {

    /**
     * All requested providers, failures included.
     */
    int totalProviders;

    int successfulProviders;

    int failedProviders;

    List<RankingEntry> rankings;

    /**
     * Null when no provider produced a scored translation.
     */
    String bestProvider;

    Double bestScore;

    /**
     * Mean overall score of the ranked providers, or null when none was ranked.
     */
    Double averageScore;
}
