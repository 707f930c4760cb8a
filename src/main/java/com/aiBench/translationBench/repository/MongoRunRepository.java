package com.aiBench.translationBench.repository;

import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB run store: collections "runs", "translations" and "evaluations".
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "benchmark.persistence.store", havingValue = "mongo")
public class MongoRunRepository implements RunRepository {

    private final MongoTemplate mongoTemplate;

    public MongoRunRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Run createRun(Run run) {
        Document saved = mongoTemplate.insert(RunDocumentMapper.toDocument(run), RunDocumentMapper.RUNS);
        String id = idOf(saved);
        log.debug("Run stored - runId: {}", id);
        return run.toBuilder().id(id).state(RunState.PERSISTED).build();
    }

    @Override
    public String createTranslation(String runId, ProviderOutcome outcome) {
        Document saved = mongoTemplate.insert(RunDocumentMapper.translationDocument(runId, outcome),
                RunDocumentMapper.TRANSLATIONS);
        return idOf(saved);
    }

    @Override
    public void createEvaluation(String translationId, String metricName, Double value, Map<String, Object> details) {
        mongoTemplate.insert(RunDocumentMapper.evaluationDocument(translationId, metricName, value, details),
                RunDocumentMapper.EVALUATIONS);
    }

    @Override
    public Optional<Run> getRun(String runId) {
        if (!ObjectId.isValid(runId)) {
            log.debug("Invalid run id: {}", runId);
            return Optional.empty();
        }
        Document document = mongoTemplate.findById(new ObjectId(runId), Document.class, RunDocumentMapper.RUNS);
        return Optional.ofNullable(document).map(d -> RunDocumentMapper.fromDocument(runId, d));
    }

    @Override
    public List<RunListItem> listRuns(int limit, int offset) {
        Query query = new Query()
                .with(Sort.by(Sort.Direction.DESC, RunDocumentMapper.CREATED_AT_MS, "_id"))
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(query, Document.class, RunDocumentMapper.RUNS).stream()
                .map(d -> RunDocumentMapper.toListItem(idOf(d), d))
                .toList();
    }

    private static String idOf(Document document) {
        Object id = document.get("_id");
        if (id == null) {
            throw new IllegalStateException("Stored document has no _id");
        }
        return id instanceof ObjectId ? ((ObjectId) id).toHexString() : id.toString();
    }
}
