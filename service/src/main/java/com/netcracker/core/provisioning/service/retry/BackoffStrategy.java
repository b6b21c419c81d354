package com.netcracker.core.provisioning.service.retry;

import java.time.Duration;

public interface BackoffStrategy {
    /**
     * @param retryCount number of consecutive failures so far, starting at 1
     */
    Duration delay(int retryCount, Duration base, Duration max);
}
