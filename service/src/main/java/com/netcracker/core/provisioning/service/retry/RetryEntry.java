package com.netcracker.core.provisioning.service.retry;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class RetryEntry {
    long resourceId;
    int retryCount;
    Duration backoff;
    Instant nextRetryAt;
}
