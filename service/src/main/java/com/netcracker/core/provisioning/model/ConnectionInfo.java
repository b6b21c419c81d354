package com.netcracker.core.provisioning.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured view of the {@code resources.connection_info} jsonb column.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionInfo {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @JsonProperty("pod_ips")
    List<String> podIps;
    @JsonProperty("ready_replicas")
    Integer readyReplicas;
    @JsonProperty("replicas")
    Integer replicas;
    @JsonProperty("service_name")
    String serviceName;
    @JsonProperty("error")
    String error;
    @JsonProperty("pod")
    String pod;

    public static ConnectionInfo error(String message) {
        return ConnectionInfo.builder().error(message).build();
    }

    public static String serviceAddress(String name, String namespace) {
        return "%s.%s.svc.cluster.local".formatted(name, namespace);
    }

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, MAP_TYPE);
    }
}
