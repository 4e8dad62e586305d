package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A target Docker host registered in the control plane.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Endpoint(
    @JsonProperty("Id") int id,
    @JsonProperty("Name") String name
) {}
