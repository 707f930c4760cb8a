package com.aiBench.translationBench.orchestrator.model;

import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A provider outcome paired with its evaluation; the evaluation is null for failed outcomes.
 */
@Value
@Builder
@Jacksonized
public class ProviderResult {

    ProviderOutcome outcome;

    ScoreBreakdown evaluation;
}
