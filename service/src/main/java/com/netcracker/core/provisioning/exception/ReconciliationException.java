package com.netcracker.core.provisioning.exception;

import lombok.Getter;

/**
 * Thrown by the reconciler after a failure has already been recorded on the resource row,
 * its provisioning job and the audit log. The controller only uses it to drive the retry queue.
 */
@Getter
public class ReconciliationException extends Exception {
    private final long resourceId;
    private final boolean terminal;

    public ReconciliationException(long resourceId, String message, Throwable cause) {
        this(resourceId, message, cause, cause instanceof UnsupportedResourceTypeException);
    }

    public ReconciliationException(long resourceId, String message, Throwable cause, boolean terminal) {
        super(message, cause);
        this.resourceId = resourceId;
        this.terminal = terminal;
    }
}
