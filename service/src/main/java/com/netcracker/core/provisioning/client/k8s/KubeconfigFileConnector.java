package com.netcracker.core.provisioning.client.k8s;

import com.netcracker.core.provisioning.exception.ControllerStartupException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public class KubeconfigFileConnector implements ClusterConnector {
    private final Path kubeconfig;

    public KubeconfigFileConnector(Path kubeconfig) {
        this.kubeconfig = Objects.requireNonNull(kubeconfig, "kubeconfig");
    }

    @Override
    public KubernetesClient connect() {
        return new KubernetesClientBuilder().withConfig(loadConfig()).build();
    }

    Config loadConfig() {
        if (!Files.isReadable(kubeconfig)) {
            throw new ControllerStartupException("Kubeconfig file '" + kubeconfig + "' does not exist or is not readable");
        }
        try {
            return Config.fromKubeconfig(null, Files.readString(kubeconfig), kubeconfig.toString());
        } catch (IOException e) {
            throw new ControllerStartupException("Failed to read kubeconfig '" + kubeconfig + "'", e);
        }
    }

    @Override
    public String description() {
        return "kubeconfig " + kubeconfig;
    }
}
