package com.netcracker.core.provisioning.client.k8s;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Strategy for building the cluster client: from the pod service account or from an
 * external credentials file.
 */
public interface ClusterConnector {
    KubernetesClient connect();

    String description();
}
