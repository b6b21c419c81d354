package com.netcracker.core.provisioning.exception;

public class ClusterOperationException extends RuntimeException {
    public ClusterOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClusterOperationException(String message) {
        super(message);
    }
}
