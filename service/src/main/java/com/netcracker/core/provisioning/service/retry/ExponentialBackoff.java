package com.netcracker.core.provisioning.service.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code min(base * 2^(retryCount - 1), max)} without jitter.
 */
public final class ExponentialBackoff implements BackoffStrategy {

    @Override
    public Duration delay(int retryCount, Duration base, Duration max) {
        Objects.requireNonNull(base);
        Objects.requireNonNull(max);
        if (base.isNegative() || max.isNegative() || base.compareTo(max) > 0)
            throw new IllegalArgumentException("Invalid backoff bounds");
        if (retryCount < 1)
            throw new IllegalArgumentException("Retry count must be positive: " + retryCount);

        int shift = retryCount - 1;
        // past 62 doublings any positive base exceeds the cap
        if (shift >= Long.SIZE - 2 || base.isZero()) {
            return base.isZero() ? Duration.ZERO : max;
        }
        long factor = 1L << shift;
        long baseMillis = base.toMillis();
        if (baseMillis > max.toMillis() / factor) {
            return max;
        }
        Duration delay = Duration.ofMillis(baseMillis * factor);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
