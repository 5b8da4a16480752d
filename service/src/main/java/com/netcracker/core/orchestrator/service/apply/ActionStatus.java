package com.netcracker.core.orchestrator.service.apply;

public enum ActionStatus {
    SUCCEEDED,
    FAILED,
    NOT_ATTEMPTED
}
