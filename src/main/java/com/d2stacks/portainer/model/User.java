package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param role 1 for administrators, 2 for standard users
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    @JsonProperty("Id") int id,
    @JsonProperty("Username") String username,
    @JsonProperty("Role") int role
) {}
