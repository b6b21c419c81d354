package com.netcracker.core.provisioning.client.k8s;

import com.netcracker.core.provisioning.exception.ClusterOperationException;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

@ApplicationScoped
@Slf4j
public class Fabric8ClusterClient implements ClusterClient {
    private final KubernetesClient client;

    @Inject
    public Fabric8ClusterClient(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public List<String> listNamespaces() {
        return call("list namespaces", () -> client.namespaces()
                .list()
                .getItems()
                .stream()
                .map(namespace -> namespace.getMetadata().getName())
                .toList());
    }

    @Override
    public boolean namespaceExists(String namespace) {
        Objects.requireNonNull(namespace, "namespace");
        return call("get namespace '" + namespace + "'",
                () -> client.namespaces().withName(namespace).get() != null);
    }

    @Override
    public void createNamespace(String namespace, Map<String, String> labels) {
        Objects.requireNonNull(namespace, "namespace");
        log.info("Creating namespace '{}'", namespace);

        Namespace resource = new NamespaceBuilder()
                .withNewMetadata()
                .withName(namespace)
                .withLabels(labels)
                .endMetadata()
                .build();

        try {
            client.namespaces().resource(resource).create();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                log.debug("Namespace '{}' was created concurrently", namespace);
                return;
            }
            throw new ClusterOperationException("Failed to create namespace '" + namespace + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<StatefulSet> getStatefulSet(String namespace, String name) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        return call("get StatefulSet '" + namespace + "/" + name + "'", () -> Optional.ofNullable(
                client.apps()
                        .statefulSets()
                        .inNamespace(namespace)
                        .withName(name)
                        .get()));
    }

    @Override
    public StatefulSet createStatefulSet(StatefulSet statefulSet) {
        String namespace = statefulSet.getMetadata().getNamespace();
        String name = statefulSet.getMetadata().getName();
        log.debug("Start creating StatefulSet '{}/{}'", namespace, name);
        return call("create StatefulSet '" + namespace + "/" + name + "'", () -> client.apps()
                .statefulSets()
                .inNamespace(namespace)
                .resource(statefulSet)
                .create());
    }

    @Override
    public StatefulSet updateStatefulSet(StatefulSet statefulSet) {
        String namespace = statefulSet.getMetadata().getNamespace();
        String name = statefulSet.getMetadata().getName();
        log.debug("Start updating StatefulSet '{}/{}'", namespace, name);
        return call("update StatefulSet '" + namespace + "/" + name + "'", () -> client.apps()
                .statefulSets()
                .inNamespace(namespace)
                .resource(statefulSet)
                .update());
    }

    @Override
    public boolean deleteStatefulSet(String namespace, String name) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        try {
            List<StatusDetails> deleted = client.apps()
                    .statefulSets()
                    .inNamespace(namespace)
                    .withName(name)
                    .delete();
            return deleted != null && !deleted.isEmpty();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return false;
            }
            throw new ClusterOperationException("Failed to delete StatefulSet '" + namespace + "/" + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<Pod> listPods(String namespace, Map<String, String> labels) {
        Objects.requireNonNull(namespace, "namespace");
        return call("list pods in '" + namespace + "'", () -> client.pods()
                .inNamespace(namespace)
                .withLabels(labels)
                .list()
                .getItems());
    }

    @Override
    public Watch watchStatefulSets(String namespace, Watcher<StatefulSet> watcher) {
        return call("watch StatefulSets in '" + namespace + "'", () -> client.apps()
                .statefulSets()
                .inNamespace(namespace)
                .watch(watcher));
    }

    @Override
    public Watch watchPods(String namespace, Watcher<Pod> watcher) {
        return call("watch pods in '" + namespace + "'", () -> client.pods()
                .inNamespace(namespace)
                .watch(watcher));
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubernetesClientException e) {
            throw new ClusterOperationException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
