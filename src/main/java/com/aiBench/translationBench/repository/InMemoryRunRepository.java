package com.aiBench.translationBench.repository;

import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local run store. Keeps the same records as the MongoDB store, as Documents in concurrent maps.
 * Contents are lost on restart.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "benchmark.persistence.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRunRepository implements RunRepository {

    private final Map<String, Document> runs = new ConcurrentHashMap<>();
    private final Map<String, Document> translations = new ConcurrentHashMap<>();
    private final Map<String, Document> evaluations = new ConcurrentHashMap<>();

    private final AtomicLong runSequence = new AtomicLong();
    private final AtomicLong translationSequence = new AtomicLong();
    private final AtomicLong evaluationSequence = new AtomicLong();

    @Override
    public Run createRun(Run run) {
        String id = String.valueOf(runSequence.incrementAndGet());
        Document document = RunDocumentMapper.toDocument(run);
        document.put("sequence", Long.parseLong(id));
        runs.put(id, document);
        log.debug("Run stored - runId: {}", id);
        return run.toBuilder().id(id).state(RunState.PERSISTED).build();
    }

    @Override
    public String createTranslation(String runId, ProviderOutcome outcome) {
        if (!runs.containsKey(runId)) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        String id = String.valueOf(translationSequence.incrementAndGet());
        translations.put(id, RunDocumentMapper.translationDocument(runId, outcome));
        return id;
    }

    @Override
    public void createEvaluation(String translationId, String metricName, Double value, Map<String, Object> details) {
        if (!translations.containsKey(translationId)) {
            throw new IllegalArgumentException("Unknown translation: " + translationId);
        }
        String id = String.valueOf(evaluationSequence.incrementAndGet());
        evaluations.put(id, RunDocumentMapper.evaluationDocument(translationId, metricName, value, details));
    }

    @Override
    public Optional<Run> getRun(String runId) {
        Document document = runs.get(runId);
        return Optional.ofNullable(document).map(d -> RunDocumentMapper.fromDocument(runId, d));
    }

    @Override
    public List<RunListItem> listRuns(int limit, int offset) {
        return runs.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, Document> e) -> e.getValue().getLong(RunDocumentMapper.CREATED_AT_MS))
                        .thenComparing(e -> e.getValue().getLong("sequence"))
                        .reversed())
                .skip(offset)
                .limit(limit)
                .map(e -> RunDocumentMapper.toListItem(e.getKey(), e.getValue()))
                .toList();
    }

    List<Document> findTranslations(String runId) {
        return translations.values().stream()
                .filter(d -> runId.equals(d.getString("run_id")))
                .sorted(Comparator.comparing(d -> d.getInteger("index")))
                .toList();
    }

    List<Document> findEvaluations(String translationId) {
        return evaluations.values().stream()
                .filter(d -> translationId.equals(d.getString("translation_id")))
                .toList();
    }

    List<String> findTranslationIds(String runId) {
        return translations.entrySet().stream()
                .filter(e -> runId.equals(e.getValue().getString("run_id")))
                .sorted(Comparator.comparing(e -> e.getValue().getInteger("index")))
                .map(Map.Entry::getKey)
                .toList();
    }
}
