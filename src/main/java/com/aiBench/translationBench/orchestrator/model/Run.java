package com.aiBench.translationBench.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One complete benchmark invocation: the request echo, every provider's outcome and
 * evaluation in submission order, and the ranking summary.
 *
 * A run is fully populated before it is persisted. {@code id} is assigned by the
 * repository and stays null for a run that could not be saved.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Run {

    String id;

    RunState state;

    String correlationId;

    String sourceText;

    String targetLang;

    /**
     * Source language as requested; null when the request asked for auto-detection.
     */
    String sourceLang;

    /**
     * Language detected from the source text when none was requested.
     */
    String detectedSourceLang;

    String referenceTranslation;

    /**
     * SHA-256 of the source text.
     */
    String textHash;

    /**
     * Providers (without credentials) and metric weights the run was executed with.
     */
    Map<String, Object> configSnapshot;

    List<ProviderResult> results;

    RunSummary summary;

    Instant createdAt;
}
