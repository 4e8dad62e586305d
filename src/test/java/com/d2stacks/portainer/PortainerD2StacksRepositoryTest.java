package com.d2stacks.portainer;

import com.d2stacks.core.model.D2NewStack;
import com.d2stacks.core.model.D2Stack;
import com.d2stacks.core.model.StackAccess;
import com.d2stacks.core.model.StackStatus;
import com.d2stacks.core.result.Result;
import com.d2stacks.core.result.Unit;
import com.d2stacks.portainer.model.Container;
import com.d2stacks.portainer.model.EnvVar;
import com.d2stacks.portainer.model.Permission;
import com.d2stacks.portainer.model.PostStackRequest;
import com.d2stacks.portainer.model.PostStackResponse;
import com.d2stacks.portainer.model.ResourceControl;
import com.d2stacks.portainer.model.Stack;
import com.d2stacks.portainer.model.UpdateStackRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PortainerD2StacksRepositoryTest {

    private PortainerApi api;
    private PortainerProperties properties;
    private PortainerD2StacksRepository repository;

    @BeforeEach
    void setUp() {
        api = mock(PortainerApi.class);
        when(api.endpointId()).thenReturn(3);
        when(api.getBaseUrl()).thenReturn("https://portainer.example.org");
        properties = new PortainerProperties();
        repository = new PortainerD2StacksRepository(new PortainerApiHolder(api), properties);
    }

    private static Container container(String id, String project, String service, String state) {
        return new Container(id, List.of("/" + project + "_" + service + "_1"), "image", state, "",
                Map.of(Container.COMPOSE_PROJECT_LABEL, project, Container.COMPOSE_SERVICE_LABEL, service));
    }

    private static Stack stack(int id, String name, ResourceControl control) {
        return new Stack(id, name, 2, 3, 1,
                List.of(new EnvVar("DHIS2_DATA_IMAGE", "eyeseetea/dhis2-data:2.32-sierra"),
                        new EnvVar("DHIS2_CORE_IMAGE", "eyeseetea/dhis2-core:2.32"),
                        new EnvVar("PORT", "8080")),
                control, 0L, "admin");
    }

    private static D2Stack d2Stack(Map<String, String> containerIds, int resourceControlId) {
        return new D2Stack(1, "dhis2-data-2-32-sierra", "eyeseetea/dhis2-data:2.32-sierra",
                "eyeseetea/dhis2-core:2.32", 8080, StackStatus.RUNNING, StackAccess.RESTRICTED,
                List.of(2), List.of(4), containerIds, resourceControlId);
    }

    // =====================================================================
    //  Listing
    // =====================================================================

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("stacks are joined with their containers through compose labels")
        void joinsContainers() {
            var restricted = new ResourceControl(21, List.of(new ResourceControl.UserAccess(4)),
                    List.of(new ResourceControl.TeamAccess(2)), false, false);
            when(api.getStacks()).thenReturn(Result.success(List.of(
                    stack(1, "alpha", restricted),
                    stack(2, "beta", null))));
            when(api.getContainers(true)).thenReturn(Result.success(List.of(
                    container("a-core", "alpha", "core", "running"),
                    container("a-db", "alpha", "db", "exited"),
                    container("b-core", "beta", "core", "exited"),
                    container("o-core", "other", "core", "running"))));

            var stacks = repository.get().orElseThrow();

            assertEquals(2, stacks.size());
            var alpha = stacks.get(0);
            assertEquals("alpha", alpha.name());
            assertEquals(StackStatus.RUNNING, alpha.status());
            assertEquals(Map.of("core", "a-core", "db", "a-db"), alpha.containerIds());
            assertEquals(StackAccess.RESTRICTED, alpha.access());
            assertEquals(List.of(2), alpha.teamIds());
            assertEquals(List.of(4), alpha.userIds());
            assertEquals(21, alpha.resourceControlId());
            assertEquals("eyeseetea/dhis2-data:2.32-sierra", alpha.dataImage());
            assertEquals("eyeseetea/dhis2-core:2.32", alpha.coreImage());
            assertEquals(8080, alpha.port());

            var beta = stacks.get(1);
            assertEquals(StackStatus.STOPPED, beta.status());
            assertEquals(StackAccess.PUBLIC, beta.access());
            assertEquals(0, beta.resourceControlId());
        }

        @Test
        @DisplayName("a failed container listing fails the whole listing")
        void containersFailure() {
            when(api.getStacks()).thenReturn(Result.success(List.of(stack(1, "alpha", null))));
            when(api.getContainers(true)).thenReturn(Result.failure("500 - Unknown error"));

            assertEquals(Result.failure("500 - Unknown error"), repository.get());
        }

        @Test
        @DisplayName("getById maps a single stack")
        void getById() {
            when(api.getStack(7)).thenReturn(Result.success(stack(7, "gamma", null)));
            when(api.getContainers(true)).thenReturn(Result.success(List.of()));

            var stack = repository.getById(7).orElseThrow();

            assertEquals(7, stack.id());
            assertEquals(StackStatus.STOPPED, stack.status());
            assertTrue(stack.containerIds().isEmpty());
        }

        @Test
        @DisplayName("a non-numeric port maps to 0")
        void badPort() {
            var odd = new Stack(1, "x", 2, 3, 1, List.of(new EnvVar("PORT", "http")), null, 0L, "");
            assertEquals(0, PortainerD2StacksRepository.toD2Stack(odd, List.of()).port());
        }
    }

    // =====================================================================
    //  Creation and update
    // =====================================================================

    @Nested
    @DisplayName("Creation")
    class Creation {

        private final D2NewStack newStack = new D2NewStack("eyeseetea/dhis2-data:2.32-sierra",
                "eyeseetea/dhis2-core:2.32", 8080, StackAccess.RESTRICTED, List.of(2), List.of(4));

        @Test
        @DisplayName("deploys from the configured repository then applies the permission")
        void createsAndAppliesPermission() {
            properties.setRepositoryUrl("https://git.example.org/d2-docker");
            when(api.createStack(any())).thenReturn(Result.success(
                    new PostStackResponse(11, "dhis2-data-2-32-sierra", 3, new ResourceControl(21, null, null, false, false))));
            when(api.setPermission(anyInt(), any())).thenReturn(Result.success(Unit.unit()));

            var result = repository.create(newStack).orElseThrow();

            assertFalse(result.hasWarnings());
            var request = ArgumentCaptor.forClass(PostStackRequest.class);
            verify(api).createStack(request.capture());
            assertEquals("dhis2-data-2-32-sierra", request.getValue().name());
            assertEquals("https://git.example.org/d2-docker", request.getValue().repositoryUrl());
            assertEquals("refs/heads/master", request.getValue().repositoryReferenceName());
            assertEquals("docker-compose.yml", request.getValue().composeFilePathInRepository());
            assertEquals(List.of(
                    new EnvVar("DHIS2_DATA_IMAGE", "eyeseetea/dhis2-data:2.32-sierra"),
                    new EnvVar("DHIS2_CORE_IMAGE", "eyeseetea/dhis2-core:2.32"),
                    new EnvVar("PORT", "8080")), request.getValue().env());
            verify(api).setPermission(21, new Permission(false, false, List.of(4), List.of(2)));
        }

        @Test
        @DisplayName("a failed permission keeps the stack and reports a warning")
        void permissionFailureIsWarning() {
            when(api.createStack(any())).thenReturn(Result.success(
                    new PostStackResponse(11, "s", 3, new ResourceControl(21, null, null, false, false))));
            when(api.setPermission(anyInt(), any())).thenReturn(Result.failure("403 - Access denied"));

            var result = repository.create(newStack);

            assertTrue(result.isSuccess());
            var warnings = result.orElseThrow().warnings();
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).contains("403 - Access denied"));
        }

        @Test
        @DisplayName("a created stack without resource control reports a warning")
        void missingResourceControl() {
            when(api.createStack(any())).thenReturn(Result.success(new PostStackResponse(11, "s", 3, null)));

            var result = repository.create(newStack).orElseThrow();

            assertTrue(result.hasWarnings());
            verify(api, never()).setPermission(anyInt(), any());
        }

        @Test
        @DisplayName("a failed creation never touches permissions")
        void createFailure() {
            when(api.createStack(any())).thenReturn(Result.failure("409 - A stack with this name already exists"));

            assertEquals(Result.failure("409 - A stack with this name already exists"), repository.create(newStack));
            verify(api, never()).setPermission(anyInt(), any());
        }

        @Test
        @DisplayName("update rewrites env then re-applies the permission")
        void update() {
            when(api.updateStack(eq(1), any())).thenReturn(Result.success(Unit.unit()));
            when(api.setPermission(anyInt(), any())).thenReturn(Result.success(Unit.unit()));
            var stack = d2Stack(Map.of(), 21).withSettings("d:1", "c:1", 9090, StackAccess.ADMIN, List.of(), List.of());

            assertTrue(repository.update(stack).isSuccess());

            InOrder inOrder = inOrder(api);
            var request = ArgumentCaptor.forClass(UpdateStackRequest.class);
            inOrder.verify(api).updateStack(eq(1), request.capture());
            inOrder.verify(api).setPermission(21, new Permission(true, false, List.of(), List.of()));
            assertEquals("9090", request.getValue().env().get(2).value());
        }

        @Test
        @DisplayName("update without resource control fails before any call")
        void updateWithoutResourceControl() {
            var result = repository.update(d2Stack(Map.of(), 0));

            assertTrue(result.isFailure());
            verify(api, never()).updateStack(anyInt(), any());
        }

        @Test
        @DisplayName("a failed env update skips the permission")
        void updateFailure() {
            when(api.updateStack(eq(1), any())).thenReturn(Result.failure("404 - Stack not found"));

            assertEquals(Result.failure("404 - Stack not found"), repository.update(d2Stack(Map.of(), 21)));
            verify(api, never()).setPermission(anyInt(), any());
        }
    }

    // =====================================================================
    //  Lifecycle
    // =====================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        private final Map<String, String> containers = new LinkedHashMap<>();

        @BeforeEach
        void setUp() {
            containers.put("gateway", "g1");
            containers.put("core", "c1");
            containers.put("db", "d1");
        }

        @Test
        @DisplayName("start walks db, core, gateway")
        void startOrder() {
            when(api.startContainer(anyString())).thenReturn(Result.success(Unit.unit()));

            assertTrue(repository.start(d2Stack(containers, 21)).isSuccess());

            InOrder inOrder = inOrder(api);
            inOrder.verify(api).startContainer("d1");
            inOrder.verify(api).startContainer("c1");
            inOrder.verify(api).startContainer("g1");
        }

        @Test
        @DisplayName("stop walks gateway, core, db")
        void stopOrder() {
            when(api.stopContainer(anyString())).thenReturn(Result.success(Unit.unit()));

            assertTrue(repository.stop(d2Stack(containers, 21)).isSuccess());

            InOrder inOrder = inOrder(api);
            inOrder.verify(api).stopContainer("g1");
            inOrder.verify(api).stopContainer("c1");
            inOrder.verify(api).stopContainer("d1");
        }

        @Test
        @DisplayName("start stops at the first failing container")
        void startStopsAtFailure() {
            when(api.startContainer("d1")).thenReturn(Result.success(Unit.unit()));
            when(api.startContainer("c1")).thenReturn(Result.failure("500 - cannot start"));

            assertEquals(Result.failure("500 - cannot start"), repository.start(d2Stack(containers, 21)));
            verify(api, never()).startContainer("g1");
        }

        @Test
        @DisplayName("delete delegates to the sequential batch delete")
        void delete() {
            when(api.deleteStacks(List.of(1, 2))).thenReturn(Result.success(Unit.unit()));

            assertTrue(repository.delete(List.of(1, 2)).isSuccess());
            verify(api).deleteStacks(List.of(1, 2));
        }

        @Test
        @DisplayName("stats URLs point at the container pages of the UI")
        void statsUrls() {
            var stats = repository.getStatsUrls(d2Stack(Map.of("core", "c1", "db", "d1"), 21));

            assertEquals("https://portainer.example.org/#!/3/docker/containers/c1/stats", stats.core());
            assertEquals("https://portainer.example.org/#!/3/docker/containers/d1/stats", stats.db());
            assertEquals("", stats.gateway());
        }
    }

    // =====================================================================
    //  Mapping helpers
    // =====================================================================

    @Test
    @DisplayName("stack names derive from the data image")
    void stackName() {
        assertEquals("dhis2-data-2-32-sierra", PortainerD2StacksRepository.stackName("eyeseetea/dhis2-data:2.32-sierra"));
        assertEquals("dhis2-data-2-30", PortainerD2StacksRepository.stackName("docker.example.org/org/DHIS2-data:2.30"));
        assertEquals("local-2-34", PortainerD2StacksRepository.stackName("local:2.34"));
    }

    @Test
    @DisplayName("access maps from and to the resource control")
    void accessMapping() {
        assertEquals(StackAccess.PUBLIC, PortainerD2StacksRepository.toAccess(null));
        assertEquals(StackAccess.PUBLIC,
                PortainerD2StacksRepository.toAccess(new ResourceControl(1, null, null, true, false)));
        assertEquals(StackAccess.ADMIN,
                PortainerD2StacksRepository.toAccess(new ResourceControl(1, null, null, false, true)));
        assertEquals(StackAccess.RESTRICTED,
                PortainerD2StacksRepository.toAccess(new ResourceControl(1, null, null, false, false)));

        assertEquals(new Permission(false, true, List.of(), List.of()),
                PortainerD2StacksRepository.toPermission(StackAccess.PUBLIC, List.of(1), List.of(2)));
        assertEquals(new Permission(true, false, List.of(), List.of()),
                PortainerD2StacksRepository.toPermission(StackAccess.ADMIN, List.of(1), List.of(2)));
        assertEquals(new Permission(false, false, List.of(2), List.of(1)),
                PortainerD2StacksRepository.toPermission(StackAccess.RESTRICTED, List.of(1), List.of(2)));
    }
}
