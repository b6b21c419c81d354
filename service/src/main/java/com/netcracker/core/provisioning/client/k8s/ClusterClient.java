package com.netcracker.core.provisioning.client.k8s;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Namespaced object operations the controller needs from the cluster.
 * <p>
 * Implementations wrap transport failures into
 * {@link com.netcracker.core.provisioning.exception.ClusterOperationException}.
 */
public interface ClusterClient {

    List<String> listNamespaces();

    boolean namespaceExists(String namespace);

    void createNamespace(String namespace, Map<String, String> labels);

    Optional<StatefulSet> getStatefulSet(String namespace, String name);

    StatefulSet createStatefulSet(StatefulSet statefulSet);

    StatefulSet updateStatefulSet(StatefulSet statefulSet);

    /**
     * @return {@code false} when the object was already absent
     */
    boolean deleteStatefulSet(String namespace, String name);

    List<Pod> listPods(String namespace, Map<String, String> labels);

    Watch watchStatefulSets(String namespace, Watcher<StatefulSet> watcher);

    Watch watchPods(String namespace, Watcher<Pod> watcher);
}
