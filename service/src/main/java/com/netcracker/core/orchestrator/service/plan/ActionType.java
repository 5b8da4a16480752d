package com.netcracker.core.orchestrator.service.plan;

public enum ActionType {
    CREATE("+"),
    UPDATE("~"),
    DESTROY("-");

    private final String symbol;

    ActionType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
