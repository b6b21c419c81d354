package com.netcracker.core.provisioning.service.watch;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.Watcher;
import lombok.Value;

import java.util.Optional;

/**
 * One change notification from a watch stream, carrying the raw object.
 */
@Value
public class ClusterEvent {
    Type type;
    Kind kind;
    String namespace;
    String name;
    HasMetadata object;

    public enum Type {
        ADDED, MODIFIED, DELETED, ERROR;

        static Optional<Type> from(Watcher.Action action) {
            return switch (action) {
                case ADDED -> Optional.of(ADDED);
                case MODIFIED -> Optional.of(MODIFIED);
                case DELETED -> Optional.of(DELETED);
                case ERROR -> Optional.of(ERROR);
                default -> Optional.empty();
            };
        }
    }

    public enum Kind {
        STATEFUL_SET("StatefulSet"),
        POD("Pod");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    static ClusterEvent of(Type type, Kind kind, HasMetadata object) {
        return new ClusterEvent(type, kind, object.getMetadata().getNamespace(), object.getMetadata().getName(), object);
    }
}
