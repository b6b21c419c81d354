package com.netcracker.core.provisioning.service;

import com.netcracker.core.provisioning.model.LifecycleMode;
import com.netcracker.core.provisioning.model.Resource;
import com.netcracker.core.provisioning.model.ResourceStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcileWorkQueueTest {

    @Test
    void sameResourceIsQueuedOnceUntilTaken() throws Exception {
        ReconcileWorkQueue queue = new ReconcileWorkQueue(10);

        assertThat(queue.offer(resource(1))).isTrue();
        assertThat(queue.offer(resource(1))).isFalse();
        assertThat(queue.size()).isEqualTo(1);

        assertThat(queue.poll(Duration.ofMillis(10))).extracting(Resource::getId).isEqualTo(1L);
        assertThat(queue.offer(resource(1))).isTrue();
    }

    @Test
    void fullQueueRejectsAndForgetsTheResource() throws Exception {
        ReconcileWorkQueue queue = new ReconcileWorkQueue(1);

        assertThat(queue.offer(resource(1))).isTrue();
        assertThat(queue.offer(resource(2))).isFalse();

        queue.poll(Duration.ofMillis(10));
        assertThat(queue.offer(resource(2))).isTrue();
    }

    @Test
    void pollTimesOutOnEmptyQueue() throws Exception {
        ReconcileWorkQueue queue = new ReconcileWorkQueue(1);

        assertThat(queue.poll(Duration.ofMillis(20))).isNull();
    }

    @Test
    void clearDropsPendingResources() {
        ReconcileWorkQueue queue = new ReconcileWorkQueue(5);
        queue.offer(resource(1));
        queue.offer(resource(2));

        queue.clear();

        assertThat(queue.size()).isZero();
        assertThat(queue.offer(resource(1))).isTrue();
    }

    private static Resource resource(long id) {
        return Resource.builder()
                .id(id)
                .name("r" + id)
                .lifecycleMode(LifecycleMode.FULL)
                .status(ResourceStatus.PENDING)
                .build();
    }
}
