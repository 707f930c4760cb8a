package com.aiBench.translationBench.repository;

import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.translation.model.ProviderOutcome;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage of runs and their child records.
 * Each operation is atomic on its own; there is no transaction spanning several calls.
 */
public interface RunRepository {

    /**
     * Stores a fully populated run.
     *
     * @return the stored run, with its id assigned and state PERSISTED
     */
    Run createRun(Run run);

    /**
     * Stores one provider outcome of a run.
     *
     * @return the translation id
     */
    String createTranslation(String runId, ProviderOutcome outcome);

    /**
     * Stores one metric value of a translation.
     */
    void createEvaluation(String translationId, String metricName, Double value, Map<String, Object> details);

    Optional<Run> getRun(String runId);

    /**
     * Most recent runs first.
     */
    List<RunListItem> listRuns(int limit, int offset);
}
