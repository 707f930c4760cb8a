package com.aiBench.translationBench.gateway.exception;

public class RunNotFoundException extends RuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
