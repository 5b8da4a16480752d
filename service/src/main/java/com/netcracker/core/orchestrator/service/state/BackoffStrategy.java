package com.netcracker.core.orchestrator.service.state;

import java.time.Duration;

/**
 * Chooses how long {@link RetryingStateStore} waits before retrying a failed state write.
 */
public interface BackoffStrategy {

    /**
     * @param current delay used before the previous attempt, {@code null} before the first retry
     * @return the delay before the next attempt, starting at {@code min} and growing towards {@code max}
     */
    Duration next(Duration current, Duration min, Duration max);
}
