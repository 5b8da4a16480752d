package com.netcracker.core.orchestrator.client.consul;

import io.vertx.core.Future;
import io.vertx.ext.consul.ConsulClient;
import io.vertx.ext.consul.KeyValue;
import io.vertx.ext.consul.KeyValueList;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking facade over the Vert.x Consul client. Calls wait at most {@code timeout} for Consul to answer.
 */
@Slf4j
public class ConsulKvClient {
    private final ConsulClient delegate;
    private final Duration timeout;

    public ConsulKvClient(ConsulClient delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate);
        this.timeout = Objects.requireNonNull(timeout);
    }

    /**
     * Returns all keys under the prefix with their values; an absent prefix yields an empty map.
     */
    public Map<String, String> getValues(String prefix) {
        KeyValueList list = await(delegate.getValues(prefix), "read " + prefix);
        List<KeyValue> entries = (list != null && list.getList() != null) ? list.getList() : List.of();
        Map<String, String> values = new LinkedHashMap<>();
        for (KeyValue kv : entries) {
            values.put(kv.getKey(), kv.getValue());
        }
        log.debug("Read {} keys under '{}'", values.size(), prefix);
        return values;
    }

    public void put(String key, String value) {
        Boolean written = await(delegate.putValue(key, value), "write " + key);
        if (!Boolean.TRUE.equals(written)) {
            throw new ConsulKvException("Consul refused to write key '" + key + "'", null);
        }
    }

    public void delete(String key) {
        await(delegate.deleteValue(key), "delete " + key);
    }

    private <T> T await(Future<T> future, String operation) {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsulKvException("Interrupted while waiting to " + operation, e);
        } catch (ExecutionException e) {
            throw new ConsulKvException("Consul failed to " + operation, e.getCause());
        } catch (TimeoutException e) {
            throw new ConsulKvException("Consul did not " + operation + " within " + timeout, e);
        }
    }
}
