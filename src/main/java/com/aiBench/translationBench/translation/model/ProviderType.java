package com.aiBench.translationBench.translation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of supported translation backends.
 */
public enum ProviderType {
    OPENAI("openai"),
    LOCAL_OPENAI("local_openai"),
    DEEPL("deepl"),
    GOOGLE_TRANSLATE("google_translate");

    private final String code;

    ProviderType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ProviderType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider type: " + code));
    }
}
