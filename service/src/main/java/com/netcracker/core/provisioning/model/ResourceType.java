package com.netcracker.core.provisioning.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResourceType {
    long id;
    String name;
    String category;
    boolean supportsFullLifecycle;
}
