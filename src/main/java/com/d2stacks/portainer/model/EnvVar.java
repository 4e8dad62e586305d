package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvVar(
    String name,
    String value
) {}
