package com.netcracker.core.orchestrator.cli;

final class ExitCodes {
    static final int OK = 0;
    static final int APPLY_FAILED = 1;
    static final int GRAPH_ERROR = 2;

    private ExitCodes() {
    }
}
