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
public class GoogleTranslateResponse {

    @JsonProperty("data")
    private ResponseData data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseData {
        @JsonProperty("translations")
        private List<Translation> translations;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Translation {
        @JsonProperty("translatedText")
        private String translatedText;

        @JsonProperty("detectedSourceLanguage")
        private String detectedSourceLanguage;
    }

    public String getTranslatedText() {
        if (data == null || data.getTranslations() == null || data.getTranslations().isEmpty()) {
            return null;
        }
        return data.getTranslations().get(0).getTranslatedText();
    }
}
