package com.aiBench.translationBench.translation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeepLTranslateResponse {

    @JsonProperty("translations")
    private List<Translation> translations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Translation {
        @JsonProperty("detected_source_language")
        private String detectedSourceLanguage;

        @JsonProperty("text")
        private String text;
    }

    public String getTranslatedText() {
        if (translations == null || translations.isEmpty() || translations.get(0) == null) {
            return null;
        }
        return translations.get(0).getText();
    }
}
