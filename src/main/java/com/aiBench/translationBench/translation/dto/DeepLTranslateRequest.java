package com.aiBench.translationBench.translation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeepLTranslateRequest {

    @JsonProperty("text")
    private List<String> text;

    @JsonProperty("target_lang")
    private String targetLang;

    @JsonProperty("source_lang")
    private String sourceLang;
}
