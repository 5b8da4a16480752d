package com.netcracker.core.orchestrator.service.graph;

import lombok.Getter;

@Getter
public class UndeclaredReferenceException extends GraphValidationException {
    private final String source;
    private final String target;

    public UndeclaredReferenceException(String source, String target) {
        super("'" + source + "' references undeclared resource '" + target + "'");
        this.source = source;
        this.target = target;
    }
}
