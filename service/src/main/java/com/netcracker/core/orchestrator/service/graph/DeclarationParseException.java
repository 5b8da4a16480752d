package com.netcracker.core.orchestrator.service.graph;

public class DeclarationParseException extends GraphValidationException {

    public DeclarationParseException(String message) {
        super(message);
    }

    public DeclarationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
