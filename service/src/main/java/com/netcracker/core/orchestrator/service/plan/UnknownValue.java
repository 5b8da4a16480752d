package com.netcracker.core.orchestrator.service.plan;

/**
 * Placeholder for a value that only exists once a pending create or replacement has been applied.
 */
public enum UnknownValue {
    INSTANCE;

    @Override
    public String toString() {
        return "(known after apply)";
    }
}
