package com.netcracker.core.orchestrator.service.apply;

import com.netcracker.core.orchestrator.model.Reference;
import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.service.OrchestratorException;

/**
 * A reference could not be substituted because the producer has no such committed value.
 */
public class UnresolvedReferenceException extends OrchestratorException {

    public UnresolvedReferenceException(ResourceId consumer, Reference reference) {
        super("'" + consumer + "' references " + reference.expression() + " which has no committed value");
    }
}
