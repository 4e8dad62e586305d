package com.d2stacks.portainer;

import com.d2stacks.core.model.MembershipMetadata;
import com.d2stacks.core.result.Result;
import com.d2stacks.portainer.model.Team;
import com.d2stacks.portainer.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PortainerMembershipRepositoryTest {

    private PortainerApi api;
    private PortainerMembershipRepository repository;

    @BeforeEach
    void setUp() {
        api = mock(PortainerApi.class);
        repository = new PortainerMembershipRepository(new PortainerApiHolder(api));
    }

    @Test
    @DisplayName("teams and users are mapped to domain types")
    void metadata() {
        when(api.getTeams()).thenReturn(Result.success(List.of(new Team(1, "devs"))));
        when(api.getUsers()).thenReturn(Result.success(List.of(new User(2, "alice", 1))));

        var metadata = repository.getMetadata();

        assertEquals(Result.success(new MembershipMetadata(
                List.of(new com.d2stacks.core.model.Team(1, "devs")),
                List.of(new com.d2stacks.core.model.User(2, "alice")))), metadata);
    }

    @Test
    @DisplayName("a failed team listing skips the users call")
    void teamsFailure() {
        when(api.getTeams()).thenReturn(Result.failure("403 - Access denied"));

        assertEquals(Result.failure("403 - Access denied"), repository.getMetadata());
        verify(api, never()).getUsers();
    }
}
