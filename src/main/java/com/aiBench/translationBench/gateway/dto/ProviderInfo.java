package com.aiBench.translationBench.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalogue entry shown to clients. Never carries credentials.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProviderInfo {

    private String type;

    private String name;

    private String model;

    private String baseUrl;

    private boolean enabled;
}
