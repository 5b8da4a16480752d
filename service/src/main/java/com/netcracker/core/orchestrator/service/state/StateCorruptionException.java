package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.service.OrchestratorException;

/**
 * Stored state does not match reality: an entry cannot be decoded, or it points at an instance
 * the provider no longer knows. Reported to the user, never repaired automatically.
 */
public class StateCorruptionException extends OrchestratorException {

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
