package com.aiBench.translationBench.gateway.exception;

import com.aiBench.translationBench.orchestrator.model.Run;

/**
 * Exception thrown when a computed run could not be saved.
 * The run is still attached so the caller can show it; it has no id and cannot be fetched later.
 */
public class RunPersistenceException extends RuntimeException {

    private final transient Run run;

    public RunPersistenceException(String message, Run run, Throwable cause) {
        super(message, cause);
        this.run = run;
    }

    public Run getRun() {
        return run;
    }
}
