package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Access-control record attached to a stack, as returned by the control plane.
 *
 * @param id                 resource-control id, the target of a permission update
 * @param userAccesses       users granted access
 * @param teamAccesses       teams granted access
 * @param isPublic           whether every user can see the resource
 * @param administratorsOnly whether only administrators can see the resource
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceControl(
    @JsonProperty("Id") int id,
    @JsonProperty("UserAccesses") List<UserAccess> userAccesses,
    @JsonProperty("TeamAccesses") List<TeamAccess> teamAccesses,
    @JsonProperty("Public") boolean isPublic,
    @JsonProperty("AdministratorsOnly") boolean administratorsOnly
) {

    public ResourceControl {
        userAccesses = userAccesses != null ? List.copyOf(userAccesses) : List.of();
        teamAccesses = teamAccesses != null ? List.copyOf(teamAccesses) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserAccess(@JsonProperty("UserId") int userId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamAccess(@JsonProperty("TeamId") int teamId) {}
}
