package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full access-scope object written to {@code PUT /resource_controls/{id}}; it replaces any prior one.
 */
public record Permission(
    @JsonProperty("AdministratorsOnly") boolean administratorsOnly,
    @JsonProperty("Public") boolean isPublic,
    @JsonProperty("Users") List<Integer> users,
    @JsonProperty("Teams") List<Integer> teams
) {

    public Permission {
        users = users != null ? List.copyOf(users) : List.of();
        teams = teams != null ? List.copyOf(teams) : List.of();
    }
}
