package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PostStackResponse(
    @JsonProperty("Id") int id,
    @JsonProperty("Name") String name,
    @JsonProperty("EndpointId") int endpointId,
    @JsonProperty("ResourceControl") ResourceControl resourceControl
) {}
