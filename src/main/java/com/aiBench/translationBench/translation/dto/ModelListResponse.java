package com.aiBench.translationBench.translation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of {@code GET /models} on an OpenAI-compatible server.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelListResponse {

    @JsonProperty("data")
    private List<ModelEntry> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelEntry {
        @JsonProperty("id")
        private String id;
    }

    public String firstModelId() {
        if (data == null || data.isEmpty() || data.get(0) == null) {
            return null;
        }
        return data.get(0).getId();
    }
}
