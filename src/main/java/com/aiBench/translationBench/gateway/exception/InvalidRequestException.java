package com.aiBench.translationBench.gateway.exception;

/**
 * Exception thrown when a run request is rejected before dispatch.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
