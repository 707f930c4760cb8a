package com.aiBench.translationBench.orchestrator.model;

/**
 * Lifecycle of a run. States are passed in declaration order, none skipped.
 */
public enum RunState {
    COLLECTING,
    EVALUATING,
    RANKED,
    PERSISTED;

    /**
     * The state that must follow this one.
     *
     * @throws IllegalStateException if this is the final state
     */
    public RunState next() {
        if (this == PERSISTED) {
            throw new IllegalStateException("Run is already persisted");
        }
        return values()[ordinal() + 1];
    }
}
