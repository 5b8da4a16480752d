package com.netcracker.core.orchestrator.client.consul;

public class ConsulKvException extends RuntimeException {

    public ConsulKvException(String message, Throwable cause) {
        super(message, cause);
    }
}
