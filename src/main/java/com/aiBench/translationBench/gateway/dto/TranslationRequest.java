package com.aiBench.translationBench.gateway.dto;

import com.aiBench.translationBench.translation.model.ProviderConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a benchmark run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranslationRequest {

    @NotBlank(message = "Text cannot be empty")
    private String text;

    @NotBlank(message = "Target language is required")
    @Size(min = 2, max = 10, message = "Target language must be between 2 and 10 characters")
    private String targetLang;

    /**
     * Null means auto-detect.
     */
    @Size(min = 2, max = 10, message = "Source language must be between 2 and 10 characters")
    private String sourceLang;

    @NotNull(message = "At least one provider is required")
    @Valid
    private List<ProviderConfig> providers;

    private String referenceTranslation;

    /**
     * Per-provider timeout override in seconds.
     */
    @Positive(message = "Timeout must be positive")
    private Integer timeout;
}
