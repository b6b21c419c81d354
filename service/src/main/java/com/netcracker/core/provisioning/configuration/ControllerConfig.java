package com.netcracker.core.provisioning.configuration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@ConfigMapping(prefix = "controller")
public interface ControllerConfig {

    Cluster cluster();

    Reconcile reconcile();

    Retry retry();

    Log log();

    Endpoint health();

    Endpoint metrics();

    /**
     * Image registry for workload objects, keyed by resource type name.
     */
    Map<String, ResourceTypeImage> resourceTypes();

    interface Cluster {
        /**
         * Use the pod service account instead of an external credentials file.
         */
        @WithDefault("true")
        boolean inCluster();

        Optional<String> kubeconfig();

        @WithDefault("nest-team-")
        String namespacePrefix();

        @WithDefault("false")
        boolean watchAllNamespaces();

        /**
         * Fixed delay before a closed or failed watch stream is reopened.
         */
        @WithDefault("5s")
        Duration watchReconnectDelay();

        @WithDefault("100")
        int eventBufferSize();
    }

    interface Reconcile {
        @WithDefault("30s")
        Duration interval();

        @WithDefault("5")
        int workers();

        @WithDefault("100")
        int queueCapacity();
    }

    interface Retry {
        @WithDefault("3")
        int maxRetries();

        @WithDefault("5s")
        Duration backoffBase();

        @WithDefault("5m")
        Duration backoffMax();
    }

    interface Log {
        @WithDefault("info")
        String level();

        @WithDefault("json")
        String format();
    }

    interface Endpoint {
        boolean enabled();

        int port();
    }

    interface ResourceTypeImage {
        String image();

        int port();
    }
}
