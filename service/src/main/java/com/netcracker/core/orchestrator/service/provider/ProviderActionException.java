package com.netcracker.core.orchestrator.service.provider;

import com.netcracker.core.orchestrator.service.OrchestratorException;

/**
 * A single remote operation failed. Re-running apply retries it.
 */
public class ProviderActionException extends OrchestratorException {

    public ProviderActionException(String message) {
        super(message);
    }

    public ProviderActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
