package com.netcracker.core.provisioning.client.k8s;

import com.netcracker.core.provisioning.configuration.ControllerConfig;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

@Slf4j
public class KubernetesClientProducer {

    @Produces
    @Singleton
    public KubernetesClient kubernetesClient(ControllerConfig config) {
        ClusterConnector connector = selectConnector(config.cluster());
        log.info("Connecting to cluster using {}", connector.description());
        return connector.connect();
    }

    void closeClient(@Disposes KubernetesClient client) {
        client.close();
    }

    static ClusterConnector selectConnector(ControllerConfig.Cluster cluster) {
        if (cluster.inCluster()) {
            return new InClusterConnector();
        }
        return cluster.kubeconfig()
                .filter(path -> !path.isBlank())
                .map(path -> (ClusterConnector) new KubeconfigFileConnector(Path.of(path)))
                .orElseGet(() -> {
                    log.warn("IN_CLUSTER=false without KUBECONFIG, falling back to default client configuration");
                    return new InClusterConnector();
                });
    }
}
