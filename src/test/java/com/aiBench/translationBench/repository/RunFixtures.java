package com.aiBench.translationBench.repository;

import com.aiBench.translationBench.evaluation.model.MetricResult;
import com.aiBench.translationBench.evaluation.model.QualityLabel;
import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import com.aiBench.translationBench.orchestrator.model.ProviderResult;
import com.aiBench.translationBench.orchestrator.model.RankingEntry;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.orchestrator.model.RunSummary;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import com.aiBench.translationBench.translation.model.ProviderTranslation;
import com.aiBench.translationBench.translation.model.ProviderType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class RunFixtures {

    private RunFixtures() {
    }

    static Run rankedRun(String sourceText, Instant createdAt) {
        ProviderOutcome success = ProviderOutcome.success(0, "OPENAI - gpt-4o-mini", ProviderType.OPENAI,
                "gpt-4o-mini", ProviderTranslation.builder().outputText("Hola mundo").usageTokens(42).build(), 350L);
        ProviderOutcome failure = ProviderOutcome.failure(1, "DEEPL - deepl", ProviderType.DEEPL, "deepl",
                "Provider timed out after 300ms", 300L);
        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .overallScore(87.5)
                .evaluationFailed(false)
                .metrics(List.of(MetricResult.builder()
                        .name("length_ratio")
                        .score(87.5)
                        .weight(0.1)
                        .details(Map.of("ratio", 0.9, "source_length", 11))
                        .warnings(List.of())
                        .build()))
                .warnings(List.of())
                .explanation("Good translation quality (score: 87.5/100). Top factors: Length Ratio.")
                .qualityLabel(QualityLabel.GOOD)
                .build();
        return Run.builder()
                .state(RunState.RANKED)
                .correlationId("corr-1")
                .sourceText(sourceText)
                .targetLang("es")
                .sourceLang("en")
                .textHash("abc123")
                .configSnapshot(Map.of("timeout_ms", 300))
                .results(List.of(
                        ProviderResult.builder().outcome(success).evaluation(breakdown).build(),
                        ProviderResult.builder().outcome(failure).build()))
                .summary(RunSummary.builder()
                        .totalProviders(2)
                        .successfulProviders(1)
                        .failedProviders(1)
                        .rankings(List.of(RankingEntry.builder()
                                .rank(1)
                                .providerName("OPENAI - gpt-4o-mini")
                                .modelId("gpt-4o-mini")
                                .overallScore(87.5)
                                .latencyMs(350L)
                                .index(0)
                                .build()))
                        .bestProvider("OPENAI - gpt-4o-mini")
                        .bestScore(87.5)
                        .averageScore(87.5)
                        .build())
                .createdAt(createdAt)
                .build();
    }
}
