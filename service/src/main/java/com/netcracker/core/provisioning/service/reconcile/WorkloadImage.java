package com.netcracker.core.provisioning.service.reconcile;

import lombok.Value;

@Value
public class WorkloadImage {
    String image;
    int port;
}
