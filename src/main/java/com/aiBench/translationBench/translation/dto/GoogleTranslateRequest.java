package com.aiBench.translationBench.translation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GoogleTranslateRequest {

    @JsonProperty("q")
    private String q;

    @JsonProperty("target")
    private String target;

    @JsonProperty("source")
    private String source;

    @JsonProperty("format")
    private String format;

    @JsonProperty("model")
    private String model;
}
