package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Docker container summary as proxied by the control plane.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Container(
    @JsonProperty("Id") String id,
    @JsonProperty("Names") List<String> names,
    @JsonProperty("Image") String image,
    @JsonProperty("State") String state,
    @JsonProperty("Status") String status,
    @JsonProperty("Labels") Map<String, String> labels
) {

    public static final String COMPOSE_PROJECT_LABEL = "com.docker.compose.project";
    public static final String COMPOSE_SERVICE_LABEL = "com.docker.compose.service";

    public Container {
        names = names != null ? List.copyOf(names) : List.of();
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public boolean isRunning() {
        return "running".equals(state);
    }

    public String label(String key) {
        return labels.getOrDefault(key, "");
    }
}
