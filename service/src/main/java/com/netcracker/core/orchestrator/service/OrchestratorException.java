package com.netcracker.core.orchestrator.service;

/**
 * Root of the orchestrator's unchecked exception hierarchy.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
