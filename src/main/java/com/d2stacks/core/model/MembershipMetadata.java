package com.d2stacks.core.model;

import java.util.List;

public record MembershipMetadata(List<Team> teams, List<User> users) {

    public MembershipMetadata {
        teams = teams != null ? List.copyOf(teams) : List.of();
        users = users != null ? List.copyOf(users) : List.of();
    }
}
