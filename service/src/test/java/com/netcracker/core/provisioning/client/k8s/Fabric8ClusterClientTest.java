package com.netcracker.core.provisioning.client.k8s;

import com.netcracker.core.provisioning.exception.ClusterOperationException;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.api.model.NamespaceListBuilder;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.AppsAPIGroupDSL;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Fabric8ClusterClientTest {
    private static final String NAMESPACE = "nest-team-a";
    private static final String NAME = "orders-db";

    private KubernetesClient client;
    private NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> namespaces;
    private RollableScalableResource<StatefulSet> namedStatefulSet;
    private Fabric8ClusterClient clusterClient;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        client = mock(KubernetesClient.class);
        namespaces = mock(NonNamespaceOperation.class);
        when(client.namespaces()).thenReturn(namespaces);

        AppsAPIGroupDSL apps = mock(AppsAPIGroupDSL.class);
        MixedOperation<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> statefulSets = mock(MixedOperation.class);
        NonNamespaceOperation<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> namespaced = mock(NonNamespaceOperation.class);
        namedStatefulSet = mock(RollableScalableResource.class);
        when(client.apps()).thenReturn(apps);
        when(apps.statefulSets()).thenReturn(statefulSets);
        when(statefulSets.inNamespace(NAMESPACE)).thenReturn(namespaced);
        when(namespaced.withName(NAME)).thenReturn(namedStatefulSet);

        clusterClient = new Fabric8ClusterClient(client);
    }

    @Test
    void listsNamespaceNames() {
        when(namespaces.list()).thenReturn(new NamespaceListBuilder()
                .addToItems(namespace("nest-team-a"), namespace("kube-system"))
                .build());

        assertThat(clusterClient.listNamespaces()).containsExactly("nest-team-a", "kube-system");
    }

    @Test
    void namespaceExistsWhenGetReturnsIt() {
        Resource<Namespace> resource = namespaceResource();
        when(namespaces.withName(NAMESPACE)).thenReturn(resource);
        when(resource.get()).thenReturn(namespace(NAMESPACE), (Namespace) null);

        assertThat(clusterClient.namespaceExists(NAMESPACE)).isTrue();
        assertThat(clusterClient.namespaceExists(NAMESPACE)).isFalse();
    }

    @Test
    void createdNamespaceCarriesLabels() {
        Resource<Namespace> resource = namespaceResource();
        ArgumentCaptor<Namespace> created = ArgumentCaptor.forClass(Namespace.class);
        when(namespaces.resource(created.capture())).thenReturn(resource);

        clusterClient.createNamespace(NAMESPACE, ManagedLabels.managedNamespace());

        assertThat(created.getValue().getMetadata().getName()).isEqualTo(NAMESPACE);
        assertThat(created.getValue().getMetadata().getLabels()).isEqualTo(Map.of("managed-by", "nest-controller"));
    }

    @Test
    void concurrentlyCreatedNamespaceIsNotAnError() {
        Resource<Namespace> resource = namespaceResource();
        when(namespaces.resource(any(Namespace.class))).thenReturn(resource);
        when(resource.create()).thenThrow(new KubernetesClientException("already exists", 409, null));

        assertThatCode(() -> clusterClient.createNamespace(NAMESPACE, Map.of())).doesNotThrowAnyException();
    }

    @Test
    void absentStatefulSetIsEmpty() {
        when(namedStatefulSet.get()).thenReturn(null);

        assertThat(clusterClient.getStatefulSet(NAMESPACE, NAME)).isEmpty();
    }

    @Test
    void deleteReportsWhetherObjectExisted() {
        when(namedStatefulSet.delete()).thenReturn(List.of(new StatusDetails()), List.of());

        assertThat(clusterClient.deleteStatefulSet(NAMESPACE, NAME)).isTrue();
        assertThat(clusterClient.deleteStatefulSet(NAMESPACE, NAME)).isFalse();
    }

    @Test
    void deleteToleratesNotFound() {
        when(namedStatefulSet.delete()).thenThrow(new KubernetesClientException("not found", 404, null));

        assertThat(clusterClient.deleteStatefulSet(NAMESPACE, NAME)).isFalse();
    }

    @Test
    void otherClusterErrorsAreWrapped() {
        when(namedStatefulSet.delete()).thenThrow(new KubernetesClientException("forbidden", 403, null));
        when(namedStatefulSet.get()).thenThrow(new KubernetesClientException("unavailable", 503, null));

        assertThatThrownBy(() -> clusterClient.deleteStatefulSet(NAMESPACE, NAME))
                .isInstanceOf(ClusterOperationException.class)
                .hasCauseInstanceOf(KubernetesClientException.class);
        assertThatThrownBy(() -> clusterClient.getStatefulSet(NAMESPACE, NAME))
                .isInstanceOf(ClusterOperationException.class)
                .hasMessageContaining("get StatefulSet 'nest-team-a/orders-db'");
    }

    @SuppressWarnings("unchecked")
    private static Resource<Namespace> namespaceResource() {
        return mock(Resource.class);
    }

    private static Namespace namespace(String name) {
        return new NamespaceBuilder().withNewMetadata().withName(name).endMetadata().build();
    }
}
