package com.aiBench.translationBench.gateway.controller;

import com.aiBench.translationBench.config.BenchmarkProperties;
import com.aiBench.translationBench.gateway.dto.HealthResponse;
import com.aiBench.translationBench.gateway.dto.ProviderInfo;
import com.aiBench.translationBench.gateway.dto.RunListItem;
import com.aiBench.translationBench.gateway.dto.TranslationRequest;
import com.aiBench.translationBench.gateway.exception.RunNotFoundException;
import com.aiBench.translationBench.orchestrator.model.Run;
import com.aiBench.translationBench.orchestrator.service.RunOrchestrator;
import com.aiBench.translationBench.repository.RunRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Benchmark REST controller - thin HTTP layer over the run orchestrator and the run store.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@Validated
@RequiredArgsConstructor
public class BenchmarkController {

    private final RunOrchestrator runOrchestrator;
    private final RunRepository runRepository;
    private final BenchmarkProperties properties;

    @Value("${benchmark.version:0.1.0}")
    private String version;

    /**
     * Runs a benchmark: translate with every provider, evaluate, rank and store.
     *
     * @param request Run request
     * @return the persisted run
     */
    @PostMapping("/run")
    public ResponseEntity<Run> run(@Valid @RequestBody TranslationRequest request) {
        return ResponseEntity.ok(runOrchestrator.execute(request));
    }

    @GetMapping("/run/{id}")
    public ResponseEntity<Run> getRun(@PathVariable String id) {
        return runRepository.getRun(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new RunNotFoundException(id));
    }

    /**
     * Run history, most recent first.
     */
    @GetMapping("/runs")
    public ResponseEntity<List<RunListItem>> listRuns(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return ResponseEntity.ok(runRepository.listRuns(limit, offset));
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderInfo>> providers() {
        List<ProviderInfo> catalogue = properties.getProvider().getCatalogue().stream()
                .map(entry -> ProviderInfo.builder()
                        .type(entry.getType())
                        .name(entry.getName())
                        .model(entry.getModel())
                        .baseUrl(entry.getBaseUrl())
                        .enabled(entry.isEnabled())
                        .build())
                .toList();
        return ResponseEntity.ok(catalogue);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", version));
    }
}
