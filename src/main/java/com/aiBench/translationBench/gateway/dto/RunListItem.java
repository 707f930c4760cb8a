package com.aiBench.translationBench.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the run history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunListItem {

    private String id;

    private Instant createdAt;

    private String sourceLang;

    private String targetLang;

    /**
     * First 100 characters of the source text, followed by "..." when truncated.
     */
    private String sourceTextPreview;

    private int providerCount;

    /**
     * Mean overall score of the scored providers, or null when none was scored.
     */
    private Double avgScore;
}
