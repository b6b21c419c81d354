package com.netcracker.core.provisioning.exception;

public class ControllerStartupException extends RuntimeException {
    public ControllerStartupException(String message, Throwable cause) {
        super(message, cause);
    }

    public ControllerStartupException(String message) {
        super(message);
    }
}
