package com.aiBench.translationBench.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One provider requested for a run: which backend, which model, and how to reach it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ProviderConfig {

    @NotNull(message = "Provider type is required")
    private ProviderType type;

    private String model;

    private String baseUrl;

    /**
     * Credential for the backend. Accepted on input, never serialized back out.
     */
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String apiKey;

    /**
     * Copy without the credential, safe for persistence and responses.
     */
    public ProviderConfig withoutCredentials() {
        return toBuilder().apiKey(null).build();
    }
}
