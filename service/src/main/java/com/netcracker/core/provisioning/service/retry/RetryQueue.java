package com.netcracker.core.provisioning.service.retry;

import com.netcracker.core.provisioning.configuration.ControllerConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory backoff tracker keyed by resource id. Entries are lost on restart.
 */
@Slf4j
@ApplicationScoped
public class RetryQueue {
    private final Map<Long, RetryEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;
    private final BackoffStrategy backoff;
    private final Duration base;
    private final Duration max;

    @Inject
    public RetryQueue(ControllerConfig config) {
        this(Clock.systemUTC(), new ExponentialBackoff(), config.retry().backoffBase(), config.retry().backoffMax());
    }

    public RetryQueue(Clock clock, BackoffStrategy backoff, Duration base, Duration max) {
        this.clock = clock;
        this.backoff = backoff;
        this.base = base;
        this.max = max;
    }

    /**
     * True while the resource is inside its backoff window.
     */
    public boolean shouldSkip(long resourceId) {
        lock.lock();
        try {
            RetryEntry entry = entries.get(resourceId);
            return entry != null && clock.instant().isBefore(entry.getNextRetryAt());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records one more failure and pushes the next eligible time out.
     */
    public RetryEntry add(long resourceId) {
        lock.lock();
        try {
            RetryEntry previous = entries.get(resourceId);
            int count = previous == null ? 1 : previous.getRetryCount() + 1;
            Duration delay = backoff.delay(count, base, max);
            Instant now = clock.instant();
            RetryEntry entry = new RetryEntry(resourceId, count, delay, now.plus(delay));
            entries.put(resourceId, entry);
            log.debug("Resource '{}' backed off for {} (retry {})", resourceId, delay, count);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public void remove(long resourceId) {
        lock.lock();
        try {
            if (entries.remove(resourceId) != null) {
                log.debug("Resource '{}' removed from retry queue", resourceId);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<RetryEntry> entry(long resourceId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(resourceId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
