package com.netcracker.core.provisioning.service;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks serializing every write to one resource row, whether it comes from the
 * periodic pass or from a cluster event. Distinct resources may share a stripe.
 */
@ApplicationScoped
public class ResourceLocks {
    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public ResourceLocks() {
        this(DEFAULT_STRIPES);
    }

    public ResourceLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("Stripe count must be positive: " + stripes);
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(long resourceId) {
        return stripes[Math.floorMod(Long.hashCode(resourceId), stripes.length)];
    }
}
