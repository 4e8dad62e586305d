package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A deployed stack as listed by {@code GET /stacks}.
 *
 * @param status 1 when active, 2 when inactive
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Stack(
    @JsonProperty("Id") int id,
    @JsonProperty("Name") String name,
    @JsonProperty("Type") int type,
    @JsonProperty("EndpointId") int endpointId,
    @JsonProperty("Status") int status,
    @JsonProperty("Env") List<EnvVar> env,
    @JsonProperty("ResourceControl") ResourceControl resourceControl,
    @JsonProperty("CreationDate") long creationDate,
    @JsonProperty("CreatedBy") String createdBy
) {

    public Stack {
        env = env != null ? List.copyOf(env) : List.of();
    }

    public String envValue(String key) {
        return env.stream()
                .filter(e -> key.equals(e.name()))
                .map(EnvVar::value)
                .findFirst()
                .orElse("");
    }
}
