package com.netcracker.core.provisioning.exception;

import lombok.Getter;

@Getter
public class UnsupportedResourceTypeException extends RuntimeException {
    private final String resourceType;

    public UnsupportedResourceTypeException(String resourceType) {
        super("unsupported resource type: " + resourceType);
        this.resourceType = resourceType;
    }
}
