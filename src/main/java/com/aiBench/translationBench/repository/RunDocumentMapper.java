package com.aiBench.translationBench.repository;

import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.translation.model.ProviderOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Converts runs and their child records to BSON Documents and back.
 * Shared by the MongoDB and in-memory stores so both keep the same record layout.
 */
public final class RunDocumentMapper {

    public static final String RUNS = "runs";
    public static final String TRANSLATIONS = "translations";
    public static final String EVALUATIONS = "evaluations";

    static final String CREATED_AT_MS = "created_at_ms";
    static final String AVG_SCORE = "avg_score";

    private static final int PREVIEW_LENGTH = 100;

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RunDocumentMapper() {
    }

    /**
     * Run header document. The id is left to the store; the stored state is PERSISTED.
     */
    public static Document toDocument(Run run) {
        Run stored = run.toBuilder().id(null).state(RunState.PERSISTED).build();
        try {
            Document document = Document.parse(objectMapper.writeValueAsString(stored));
            document.remove("id");
            Instant createdAt = run.getCreatedAt() != null ? run.getCreatedAt() : Instant.now();
            document.put(CREATED_AT_MS, createdAt.toEpochMilli());
            document.put(AVG_SCORE, run.getSummary() != null ? run.getSummary().getAverageScore() : null);
            return document;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to convert run to document", e);
        }
    }

    public static Run fromDocument(String id, Document document) {
        Document copy = new Document(document);
        copy.remove("_id");
        copy.remove(CREATED_AT_MS);
        copy.remove(AVG_SCORE);
        try {
            return objectMapper.readValue(copy.toJson(), Run.class).toBuilder().id(id).build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read run document " + id, e);
        }
    }

    public static RunListItem toListItem(String id, Document document) {
        String sourceText = document.getString("source_text");
        Document summary = document.get("summary", Document.class);
        Number providerCount = summary != null ? summary.get("total_providers", Number.class) : null;
        Number avgScore = document.get(AVG_SCORE, Number.class);
        Number createdAtMs = document.get(CREATED_AT_MS, Number.class);
        return RunListItem.builder()
                .id(id)
                .createdAt(createdAtMs != null ? Instant.ofEpochMilli(createdAtMs.longValue()) : null)
                .sourceLang(document.getString("source_lang"))
                .targetLang(document.getString("target_lang"))
                .sourceTextPreview(preview(sourceText))
                .providerCount(providerCount != null ? providerCount.intValue() : 0)
                .avgScore(avgScore != null ? avgScore.doubleValue() : null)
                .build();
    }

    public static Document translationDocument(String runId, ProviderOutcome outcome) {
        return new Document("run_id", runId)
                .append("index", outcome.getIndex())
                .append("provider_name", outcome.getProviderName())
                .append("provider_type", outcome.getProviderType() != null ? outcome.getProviderType().getCode() : null)
                .append("model_id", outcome.getModelId())
                .append("output_text", outcome.getOutputText())
                .append("latency_ms", outcome.getLatencyMs())
                .append("usage_tokens", outcome.getUsageTokens())
                .append("error", outcome.getError());
    }

    public static Document evaluationDocument(String translationId, String metricName, Double value,
                                              Map<String, Object> details) {
        return new Document("translation_id", translationId)
                .append("metric_name", metricName)
                .append("metric_value", value)
                .append("details", details != null ? new Document(details) : new Document());
    }

    static String preview(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
