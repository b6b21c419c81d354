package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.model.Resource;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue of resources awaiting a reconcile worker. A resource id is queued at most once
 * until a worker takes it.
 */
public class ReconcileWorkQueue {
    private final BlockingQueue<Resource> queue;
    private final Set<Long> pending = ConcurrentHashMap.newKeySet();

    public ReconcileWorkQueue(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * @return {@code false} if the resource is already queued or the queue is full
     */
    public boolean offer(Resource resource) {
        if (!pending.add(resource.getId())) {
            return false;
        }
        if (!queue.offer(resource)) {
            pending.remove(resource.getId());
            return false;
        }
        return true;
    }

    public Resource poll(Duration timeout) throws InterruptedException {
        Resource resource = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (resource != null) {
            pending.remove(resource.getId());
        }
        return resource;
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
        pending.clear();
    }
}
