package com.d2stacks.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A deployed DHIS2 stack on the session's endpoint.
 *
 * @param id                stack id in the control plane
 * @param name              stack (compose project) name
 * @param dataImage         image holding the database contents
 * @param coreImage         DHIS2 core image
 * @param port              published HTTP port
 * @param status            RUNNING when any of its containers runs
 * @param access            access scope
 * @param teamIds           teams granted access when RESTRICTED
 * @param userIds           users granted access when RESTRICTED
 * @param containerIds      container ids keyed by compose service (core, db, gateway, ...)
 * @param resourceControlId resource control carrying the stack's permission, 0 when none
 */
public record D2Stack(
    int id,
    String name,
    String dataImage,
    String coreImage,
    int port,
    StackStatus status,
    StackAccess access,
    List<Integer> teamIds,
    List<Integer> userIds,
    Map<String, String> containerIds,
    int resourceControlId
) {

    public D2Stack {
        teamIds = teamIds != null ? List.copyOf(teamIds) : List.of();
        userIds = userIds != null ? List.copyOf(userIds) : List.of();
        containerIds = containerIds != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(containerIds))
                : Map.of();
    }

    public D2Stack withSettings(String dataImage, String coreImage, int port, StackAccess access,
                                List<Integer> teamIds, List<Integer> userIds) {
        return new D2Stack(id, name, dataImage, coreImage, port, status, access, teamIds, userIds,
                containerIds, resourceControlId);
    }
}
