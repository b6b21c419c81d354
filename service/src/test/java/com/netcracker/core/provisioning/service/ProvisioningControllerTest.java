package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.client.db.DatabaseGateway;
import com.netcracker.core.provisioning.exception.ControllerStartupException;
import com.netcracker.core.provisioning.exception.ReconciliationException;
import com.netcracker.core.provisioning.model.LifecycleMode;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import com.netcracker.core.provisioning.service.reconcile.Reconciler;
import com.netcracker.core.provisioning.service.retry.ExponentialBackoff;
import com.netcracker.core.provisioning.service.retry.MutableClock;
import com.netcracker.core.provisioning.service.retry.RetryQueue;
import com.netcracker.core.provisioning.service.watch.ClusterEvent;
import com.netcracker.core.provisioning.service.watch.ClusterWatcher;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProvisioningControllerTest {
    private static final Duration NEVER_AGAIN = Duration.ofHours(1);
    private static final long WAIT_MS = 2_000;

    private DatabaseGateway database;
    private Reconciler reconciler;
    private ClusterWatcher watcher;
    private ClusterEventHandler eventHandler;
    private MutableClock clock;
    private RetryQueue retryQueue;
    private SimpleMeterRegistry registry;
    private final Map<Long, Resource> rows = new ConcurrentHashMap<>();
    private ProvisioningController controller;

    @BeforeEach
    void setUp() throws Exception {
        database = mock(DatabaseGateway.class);
        reconciler = mock(Reconciler.class);
        watcher = mock(ClusterWatcher.class);
        eventHandler = mock(ClusterEventHandler.class);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        retryQueue = new RetryQueue(clock, new ExponentialBackoff(), Duration.ofSeconds(5), Duration.ofMinutes(5));
        registry = new SimpleMeterRegistry();

        when(database.findFullLifecycleResources()).thenReturn(List.of());
        when(database.findPendingTeardown()).thenReturn(List.of());
        when(database.findById(anyLong())).thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<Long>getArgument(0))));
        when(watcher.poll(any())).thenAnswer(invocation -> {
            Thread.sleep(20);
            return null;
        });
    }

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.stop();
        }
    }

    @Test
    void initialPassReconcilesLiveAndSoftDeletedResources() throws Exception {
        Resource live = resource(1);
        Resource deleted = resource(2).toBuilder().deletedAt(Instant.now()).build();
        when(database.findFullLifecycleResources()).thenReturn(List.of(live));
        stored(live);
        when(database.findPendingTeardown()).thenReturn(List.of(deleted));
        stored(deleted);
        controller = controller(0, 3);

        controller.start();

        verify(reconciler, timeout(WAIT_MS)).reconcile(live);
        verify(reconciler, timeout(WAIT_MS)).reconcile(deleted);
        verify(watcher).start();
    }

    @Test
    void failedResourceIsBackedOff() throws Exception {
        Resource failing = resource(1);
        when(database.findFullLifecycleResources()).thenReturn(List.of(failing));
        stored(failing);
        doThrow(new ReconciliationException(1, "create failed", new IllegalStateException("boom")))
                .when(reconciler).reconcile(failing);
        controller = controller(0, 3);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(failing);
        controller.stop();

        assertThat(retryQueue.entry(1)).isPresent();
        assertThat(retryQueue.shouldSkip(1)).isTrue();
        assertThat(registry.get("nest.controller.reconcile").tags("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("nest.controller.retry.queue.size").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void resourceInBackoffIsSkipped() throws Exception {
        Resource backedOff = resource(1);
        Resource eligible = resource(2);
        when(database.findFullLifecycleResources()).thenReturn(List.of(backedOff, eligible));
        stored(backedOff, eligible);
        retryQueue.add(1);
        controller = controller(0, 3);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(eligible);
        controller.stop();

        verify(reconciler, never()).reconcile(backedOff);
    }

    @Test
    void successAfterBackoffClearsRetryEntry() throws Exception {
        Resource recovered = resource(1);
        when(database.findFullLifecycleResources()).thenReturn(List.of(recovered));
        stored(recovered);
        retryQueue.add(1);
        clock.advance(Duration.ofSeconds(6));
        controller = controller(0, 3);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(recovered);
        controller.stop();

        assertThat(retryQueue.entry(1)).isEmpty();
        assertThat(registry.get("nest.controller.reconcile").tags("outcome", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failuresPastMaxRetriesKeepRetryingAndAreCounted() throws Exception {
        Resource failing = resource(1);
        when(database.findFullLifecycleResources()).thenReturn(List.of(failing));
        stored(failing);
        doThrow(new ReconciliationException(1, "still failing", new IllegalStateException("boom")))
                .when(reconciler).reconcile(failing);
        retryQueue.add(1);
        clock.advance(Duration.ofSeconds(6));
        controller = controller(0, 1);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(failing);
        controller.stop();

        assertThat(retryQueue.entry(1)).get().extracting(entry -> entry.getRetryCount()).isEqualTo(2);
        assertThat(registry.get("nest.controller.retry.exhausted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedRuntimeFailureIsAlsoBackedOff() throws Exception {
        Resource failing = resource(1);
        when(database.findFullLifecycleResources()).thenReturn(List.of(failing));
        stored(failing);
        doThrow(new IllegalStateException("bug")).when(reconciler).reconcile(failing);
        controller = controller(0, 3);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(failing);
        controller.stop();

        assertThat(retryQueue.entry(1)).isPresent();
    }

    @Test
    void workersDrainTheWorkQueue() throws Exception {
        List<Resource> resources = List.of(resource(1), resource(2), resource(3));
        when(database.findFullLifecycleResources()).thenReturn(resources);
        stored(resources.toArray(new Resource[0]));
        controller = controller(2, 3);

        controller.start();

        for (Resource resource : resources) {
            verify(reconciler, timeout(WAIT_MS)).reconcile(resource);
        }
    }

    @Test
    void databaseFailureSkipsThePass() throws Exception {
        when(database.findFullLifecycleResources()).thenThrow(new IllegalStateException("connection refused"));
        controller = controller(0, 3);

        controller.start();
        verify(database, timeout(WAIT_MS)).findFullLifecycleResources();
        controller.stop();

        verifyNoInteractions(reconciler);
    }

    @Test
    void watcherEventsAreDispatchedAndFailuresDoNotStopTheLoop() throws Exception {
        ClusterEvent first = podEvent("a-0");
        ClusterEvent second = podEvent("a-1");
        when(watcher.poll(any())).thenReturn(first, second).thenAnswer(invocation -> {
            Thread.sleep(20);
            return null;
        });
        doThrow(new IllegalStateException("db down")).when(eventHandler).handle(first);
        controller = controller(0, 3);

        controller.start();

        verify(eventHandler, timeout(WAIT_MS)).handle(first);
        verify(eventHandler, timeout(WAIT_MS)).handle(second);
    }

    @Test
    void watcherStartFailureIsFatal() {
        doThrow(new ControllerStartupException("cannot list namespaces")).when(watcher).start();
        controller = controller(2, 3);

        assertThatThrownBy(() -> controller.start()).isInstanceOf(ControllerStartupException.class);

        assertThat(controller.isRunning()).isFalse();
        verifyNoInteractions(database, reconciler);
    }

    @Test
    void stopWaitsForLoopsAndStopsWatcher() {
        controller = controller(2, 3);
        controller.start();
        assertThat(controller.isRunning()).isTrue();

        controller.stop();
        controller.stop();

        assertThat(controller.isRunning()).isFalse();
        verify(watcher).stop(any());
    }

    @Test
    void startingTwiceIsRejected() {
        controller = controller(0, 3);
        controller.start();

        assertThatThrownBy(() -> controller.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void workerReconcilesCurrentRowInsteadOfListedSnapshot() throws Exception {
        Resource listed = resource(1);
        Resource current = listed.toBuilder().deletedAt(Instant.now()).build();
        when(database.findFullLifecycleResources()).thenReturn(List.of(listed));
        stored(current);
        controller = controller(1, 3);

        controller.start();
        verify(reconciler, timeout(WAIT_MS)).reconcile(current);
        controller.stop();

        verify(reconciler, never()).reconcile(listed);
    }

    @Test
    void rowRemovedBeforeReconcileIsSkipped() throws Exception {
        Resource vanished = resource(1);
        when(database.findFullLifecycleResources()).thenReturn(List.of(vanished));
        retryQueue.add(1);
        clock.advance(Duration.ofSeconds(6));
        controller = controller(0, 3);

        controller.start();
        verify(database, timeout(WAIT_MS)).findById(1L);
        controller.stop();

        verifyNoInteractions(reconciler);
        assertThat(retryQueue.entry(1)).isEmpty();
    }

    private void stored(Resource... resources) {
        for (Resource resource : resources) {
            rows.put(resource.getId(), resource);
        }
    }

    private ProvisioningController controller(int workers, int maxRetries) {
        return new ProvisioningController(database, reconciler, retryQueue, watcher, eventHandler,
                new ResourceLocks(), new ControllerMetrics(registry),
                NEVER_AGAIN, workers, 10, maxRetries, Duration.ofSeconds(1));
    }

    private static Resource resource(long id) {
        return Resource.builder()
                .id(id)
                .name("db-" + id)
                .teamId(1)
                .resourceTypeId(1)
                .lifecycleMode(LifecycleMode.FULL)
                .status(ResourceStatus.PENDING)
                .k8sNamespace("nest-team-a")
                .build();
    }

    private static ClusterEvent podEvent(String name) {
        return new ClusterEvent(ClusterEvent.Type.MODIFIED, ClusterEvent.Kind.POD, "nest-team-a", name,
                new PodBuilder().withNewMetadata().withName(name).withNamespace("nest-team-a").endMetadata().build());
    }
}
