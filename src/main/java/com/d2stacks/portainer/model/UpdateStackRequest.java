package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UpdateStackRequest(
    @JsonProperty("Env") List<EnvVar> env,
    @JsonProperty("Prune") boolean prune
) {

    public UpdateStackRequest {
        env = env != null ? List.copyOf(env) : List.of();
    }
}
