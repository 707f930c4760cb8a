package com.aiBench.translationBench.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RankingEntry {

    /**
     * 1-based, unique, without gaps.
     */
    int rank;

    String providerName;

    String modelId;

    double overallScore;

    long latencyMs;

    /**
     * Submission index of the provider in the request.
     */
    int index;
}
