package com.aiBench.translationBench.gateway.controller;

import com.aiBench.translationBench.config.BenchmarkProperties;
import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.gateway.dto.TranslationRequest;
import com.aiBench.translationBench.gateway.exception.InvalidRequestException;
import com.aiBench.translationBench.gateway.exception.RunPersistenceException;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.model.RunState;
import com.aiBench.translationBench.orchestrator.service.RunOrchestrator;
import com.aiBench.translationBench.repository.RunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BenchmarkController.class)
@Import(BenchmarkControllerTest.PropertiesConfig.class)
@DisplayName("BenchmarkController Tests")
class BenchmarkControllerTest {

    private static final String VALID_REQUEST = """
            {
              "text": "Hello world",
              "target_lang": "es",
              "providers": [{"type": "openai", "model": "gpt-4o-mini", "api_key": "sk-secret"}]
            }
            """;

    @TestConfiguration
    @EnableConfigurationProperties(BenchmarkProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunOrchestrator runOrchestrator;

    @MockBean
    private RunRepository runRepository;

    private static Run persistedRun() {
        return Run.builder()
                .id("1")
                .state(RunState.PERSISTED)
                .sourceText("Hello world")
                .targetLang("es")
                .results(List.of())
                .createdAt(Instant.parse("2026-10-18T10:15:30Z"))
                .build();
    }

    // ========== POST /api/run ==========

    @Test
    @DisplayName("Should run a benchmark and return the persisted run")
    void testRun_Success() throws Exception {
        when(runOrchestrator.execute(any(TranslationRequest.class))).thenReturn(persistedRun());

        mockMvc.perform(post("/api/run").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("1"))
                .andExpect(jsonPath("$.state").value("PERSISTED"))
                .andExpect(jsonPath("$.source_text").value("Hello world"));
    }

    @Test
    @DisplayName("Should reject an empty text before running")
    void testRun_EmptyText() throws Exception {
        String body = VALID_REQUEST.replace("Hello world", "");

        mockMvc.perform(post("/api/run").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verify(runOrchestrator, never()).execute(any());
    }

    @Test
    @DisplayName("Should reject an unknown provider type as malformed")
    void testRun_UnknownProviderType() throws Exception {
        String body = VALID_REQUEST.replace("\"openai\"", "\"babelfish\"");

        mockMvc.perform(post("/api/run").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("Should map an invalid run request to 400")
    void testRun_InvalidRequest() throws Exception {
        when(runOrchestrator.execute(any(TranslationRequest.class)))
                .thenThrow(new InvalidRequestException("At least one provider must be configured"));

        mockMvc.perform(post("/api/run").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value("At least one provider must be configured"));
    }

    @Test
    @DisplayName("Should return the computed run when it could not be saved")
    void testRun_PersistenceFailure() throws Exception {
        Run ranked = persistedRun().toBuilder().id(null).state(RunState.RANKED).build();
        when(runOrchestrator.execute(any(TranslationRequest.class)))
                .thenThrow(new RunPersistenceException("Run could not be saved: store unavailable", ranked,
                        new IllegalStateException("store unavailable")));

        mockMvc.perform(post("/api/run").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("RUN_NOT_SAVED"))
                .andExpect(jsonPath("$.run.state").value("RANKED"))
                .andExpect(jsonPath("$.run.source_text").value("Hello world"));
    }

    // ========== Queries ==========

    @Test
    @DisplayName("Should return a stored run")
    void testGetRun_Found() throws Exception {
        when(runRepository.getRun("1")).thenReturn(Optional.of(persistedRun()));

        mockMvc.perform(get("/api/run/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.target_lang").value("es"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown run")
    void testGetRun_NotFound() throws Exception {
        when(runRepository.getRun("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/run/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("RUN_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should list runs with default paging")
    void testListRuns_Defaults() throws Exception {
        when(runRepository.listRuns(50, 0)).thenReturn(List.of(RunListItem.builder()
                .id("1")
                .sourceTextPreview("Hello world")
                .targetLang("es")
                .providerCount(2)
                .avgScore(81.0)
                .build()));

        mockMvc.perform(get("/api/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].source_text_preview").value("Hello world"))
                .andExpect(jsonPath("$[0].avg_score").value(81.0));
    }

    @Test
    @DisplayName("Should reject a limit above the maximum")
    void testListRuns_LimitTooLarge() throws Exception {
        mockMvc.perform(get("/api/runs").param("limit", "1000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should list the provider catalogue")
    void testProviders() throws Exception {
        mockMvc.perform(get("/api/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)))
                .andExpect(jsonPath("$[0].type").value("openai"))
                .andExpect(jsonPath("$[1].base_url").value("http://localhost:1234/v1"));
    }

    @Test
    @DisplayName("Should report health with the version")
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").value("0.1.0"));
    }
}
