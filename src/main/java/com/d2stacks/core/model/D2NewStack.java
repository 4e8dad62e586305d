package com.d2stacks.core.model;

import java.util.List;

/**
 * A DHIS2 stack to be created: a data image, the core image serving it and the published port.
 */
public record D2NewStack(
    String dataImage,
    String coreImage,
    int port,
    StackAccess access,
    List<Integer> teamIds,
    List<Integer> userIds
) {

    public D2NewStack {
        access = access != null ? access : StackAccess.RESTRICTED;
        teamIds = teamIds != null ? List.copyOf(teamIds) : List.of();
        userIds = userIds != null ? List.copyOf(userIds) : List.of();
    }
}
