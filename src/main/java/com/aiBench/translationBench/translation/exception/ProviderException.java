package com.aiBench.translationBench.translation.exception;

/**
 * A translation backend could not produce a translation: transport error,
 * vendor error response, or an unusable answer.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
