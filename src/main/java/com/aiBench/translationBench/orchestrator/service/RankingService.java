package com.aiBench.translationBench.orchestrator.service;

import com.aiBench.translationBench.evaluation.model.ScoreBreakdown;
import com.aiBench.translationBench.orchestrator.model.ProviderResult;
import com.aiBench.translationBench.orchestrator.model.RankingEntry;
import com.aiBench.translationBench.orchestrator.model.RunSummary;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks the scored providers of a run and builds its summary.
 *
 * Order: overall score descending, then latency ascending, then submission index
 * ascending. The order is total, so ranks are 1..k without ties or gaps.
 */
@Slf4j
@Service
public class RankingService {

    static final Comparator<ProviderResult> RANKING_ORDER = Comparator
            .comparingDouble((ProviderResult r) -> r.getEvaluation().getOverallScore()).reversed()
            .thenComparingLong(r -> r.getOutcome().getLatencyMs())
            .thenComparingInt(r -> r.getOutcome().getIndex());

    public RunSummary summarize(List<ProviderResult> results) {
        List<ProviderResult> ranked = results.stream()
                .filter(RankingService::isRankable)
                .sorted(RANKING_ORDER)
                .toList();

        List<RankingEntry> rankings = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ProviderOutcome outcome = ranked.get(i).getOutcome();
            rankings.add(RankingEntry.builder()
                    .rank(i + 1)
                    .providerName(outcome.getProviderName())
                    .modelId(outcome.getModelId())
                    .overallScore(ranked.get(i).getEvaluation().getOverallScore())
                    .latencyMs(outcome.getLatencyMs())
                    .index(outcome.getIndex())
                    .build());
        }

        int successful = (int) results.stream().filter(r -> r.getOutcome().isSuccess()).count();
        RankingEntry best = rankings.isEmpty() ? null : rankings.get(0);
        Double average = rankings.isEmpty() ? null : rankings.stream()
                .mapToDouble(RankingEntry::getOverallScore)
                .average()
                .orElseThrow();

        log.debug("Run ranked - providers: {}, ranked: {}, best: {}",
                results.size(), rankings.size(), best != null ? best.getProviderName() : "none");

        return RunSummary.builder()
                .totalProviders(results.size())
                .successfulProviders(successful)
                .failedProviders(results.size() - successful)
                .rankings(rankings)
                .bestProvider(best != null ? best.getProviderName() : null)
                .bestScore(best != null ? best.getOverallScore() : null)
                .averageScore(average)
                .build();
    }

    private static boolean isRankable(ProviderResult result) {
        ScoreBreakdown evaluation = result.getEvaluation();
        return result.getOutcome().isSuccess() && evaluation != null && evaluation.hasScore();
    }
}
