package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.service.OrchestratorException;

/**
 * A problem with the declarations themselves, detected before any remote call is made.
 * Not retryable without fixing the declarations.
 */
public abstract class GraphValidationException extends OrchestratorException {

    protected GraphValidationException(String message) {
        super(message);
    }

    protected GraphValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
