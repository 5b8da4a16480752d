package com.netcracker.core.orchestrator.service.state;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Doubles the previous delay up to {@code max} and spreads it by +/-15% so that concurrent writers
 * do not retry in lock step.
 */
public final class ExponentialJitterBackoff implements BackoffStrategy {
    private static final double JITTER = 0.15;

    private final Random random;

    public ExponentialJitterBackoff() {
        this(new Random());
    }

    ExponentialJitterBackoff(Random random) {
        this.random = random;
    }

    @Override
    public Duration next(Duration current, Duration min, Duration max) {
        Objects.requireNonNull(min);
        Objects.requireNonNull(max);
        if (min.isNegative() || max.isNegative() || min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Invalid backoff bounds");
        }

        Duration base = current == null || current.isZero() ? min : current.multipliedBy(2);
        if (base.compareTo(max) > 0) {
            base = max;
        }

        double factor = 1.0 + (random.nextDouble() * 2 * JITTER - JITTER);
        long millis = Math.max(1, Math.round(base.toMillis() * factor));
        return Duration.ofMillis(millis);
    }
}
