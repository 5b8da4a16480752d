package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.service.OrchestratorException;

/**
 * The backing storage could not be read or written.
 */
public class StateStoreException extends OrchestratorException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
