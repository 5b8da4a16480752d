package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.model.ResourceId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries writes of a remote backend that failed with a {@link StateStoreException}.
 * Corruption is never retried. Gives up after {@code maxAttempts} and rethrows the last failure.
 */
@Slf4j
public class RetryingStateStore implements StateStore {
    private final StateStore delegate;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final BackoffStrategy backoff;
    private final Sleeper sleeper;

    public RetryingStateStore(StateStore delegate, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        this(delegate, maxAttempts, initialDelay, maxDelay, new ExponentialJitterBackoff(), Thread::sleep);
    }

    RetryingStateStore(StateStore delegate,
                       int maxAttempts,
                       Duration initialDelay,
                       Duration maxDelay,
                       BackoffStrategy backoff,
                       Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    @Override
    public StateSnapshot load() {
        return withRetries("load state", delegate::load);
    }

    @Override
    public void commit(ResourceId id, ResourceState state) {
        withRetries("commit '" + id + "'", () -> {
            delegate.commit(id, state);
            return null;
        });
    }

    @Override
    public void remove(ResourceId id) {
        withRetries("remove '" + id + "'", () -> {
            delegate.remove(id);
            return null;
        });
    }

    private <T> T withRetries(String operation, Supplier<T> action) {
        Duration delay = Duration.ZERO;
        for (int attempt = 1; ; attempt++) {
            try {
                T result = action.get();
                if (attempt > 1) {
                    log.info("Succeeded to {} after {} attempts", operation, attempt);
                }
                return result;
            } catch (StateStoreException ex) {
                if (attempt >= maxAttempts) {
                    log.error("Failed to {} after {} attempts", operation, attempt, ex);
                    throw ex;
                }
                delay = backoff.next(delay, initialDelay, maxDelay);
                log.warn("Failed to {} on attempt {}/{}. Retrying in {}.", operation, attempt, maxAttempts, delay, ex);
                pause(delay, ex);
            }
        }
    }

    private void pause(Duration delay, StateStoreException failure) {
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(e);
            throw failure;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
