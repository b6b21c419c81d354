package com.netcracker.core.provisioning.client.k8s;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

public class InClusterConnector implements ClusterConnector {

    @Override
    public KubernetesClient connect() {
        Config config = Config.autoConfigure(null);
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    @Override
    public String description() {
        return "in-cluster service account";
    }
}
