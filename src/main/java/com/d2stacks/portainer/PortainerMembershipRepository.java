package com.d2stacks.portainer;

import com.d2stacks.core.model.MembershipMetadata;
import com.d2stacks.core.model.Team;
import com.d2stacks.core.model.User;
import com.d2stacks.core.repository.MembershipRepository;
import com.d2stacks.core.result.Result;

import java.util.stream.Collectors;

public class PortainerMembershipRepository implements MembershipRepository {

    private final PortainerApiHolder holder;

    public PortainerMembershipRepository(PortainerApiHolder holder) {
        this.holder = holder;
    }

    @Override
    public Result<MembershipMetadata, String> getMetadata() {
        var api = holder.current();
        return api.getTeams().flatMap(teams -> api.getUsers().map(users -> new MembershipMetadata(
                teams.stream().map(t -> new Team(t.id(), t.name())).collect(Collectors.toList()),
                users.stream().map(u -> new User(u.id(), u.username())).collect(Collectors.toList()))));
    }
}
