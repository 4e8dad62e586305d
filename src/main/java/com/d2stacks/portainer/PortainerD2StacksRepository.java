package com.d2stacks.portainer;

import com.d2stacks.core.logging.MdcContext;
import com.d2stacks.core.model.D2NewStack;
import com.d2stacks.core.model.D2Stack;
import com.d2stacks.core.model.D2StackStats;
import com.d2stacks.core.model.MaybeWarnings;
import com.d2stacks.core.model.StackAccess;
import com.d2stacks.core.model.StackStatus;
import com.d2stacks.core.repository.D2StacksRepository;
import com.d2stacks.core.result.Result;
import com.d2stacks.core.result.Unit;
import com.d2stacks.portainer.model.Container;
import com.d2stacks.portainer.model.EnvVar;
import com.d2stacks.portainer.model.Permission;
import com.d2stacks.portainer.model.PostStackRequest;
import com.d2stacks.portainer.model.ResourceControl;
import com.d2stacks.portainer.model.Stack;
import com.d2stacks.portainer.model.UpdateStackRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * DHIS2 stacks backed by Portainer compose stacks deployed from the d2-docker repository.
 *
 * <p>A stack's containers are found through their compose labels: the project label
 * names the stack and the service label gives the role ({@code core}, {@code db},
 * {@code gateway}). Images and port travel as stack environment variables.
 */
public class PortainerD2StacksRepository implements D2StacksRepository {

    private static final Logger log = LoggerFactory.getLogger(PortainerD2StacksRepository.class);

    static final String DATA_IMAGE_ENV = "DHIS2_DATA_IMAGE";
    static final String CORE_IMAGE_ENV = "DHIS2_CORE_IMAGE";
    static final String PORT_ENV = "PORT";

    /** Start order; stopping walks it backwards. */
    static final List<String> SERVICE_ORDER = List.of("db", "core", "gateway");

    private final PortainerApiHolder holder;
    private final PortainerProperties properties;

    public PortainerD2StacksRepository(PortainerApiHolder holder, PortainerProperties properties) {
        this.holder = holder;
        this.properties = properties;
    }

    @Override
    public Result<List<D2Stack>, String> get() {
        var api = holder.current();
        return api.getStacks().flatMap(stacks -> api.getContainers(true)
                .map(containers -> stacks.stream()
                        .map(stack -> toD2Stack(stack, containers))
                        .collect(Collectors.toList())));
    }

    @Override
    public Result<D2Stack, String> getById(int id) {
        var api = holder.current();
        return api.getStack(id).flatMap(stack -> api.getContainers(true)
                .map(containers -> toD2Stack(stack, containers)));
    }

    @Override
    public Result<Unit, String> delete(List<Integer> ids) {
        var api = holder.current();
        MdcContext.setOperation("delete", api.endpointId());
        try {
            return api.deleteStacks(ids);
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public Result<Unit, String> start(D2Stack stack) {
        var api = holder.current();
        log.info("Starting stack {} ({} containers)", stack.name(), stack.containerIds().size());
        return forEachContainer(orderedContainerIds(stack, false), api::startContainer);
    }

    @Override
    public Result<Unit, String> stop(D2Stack stack) {
        var api = holder.current();
        log.info("Stopping stack {} ({} containers)", stack.name(), stack.containerIds().size());
        return forEachContainer(orderedContainerIds(stack, true), api::stopContainer);
    }

    @Override
    public Result<MaybeWarnings<Unit>, String> create(D2NewStack newStack) {
        var api = holder.current();
        MdcContext.setOperation("create", api.endpointId());
        try {
            var request = new PostStackRequest(
                    stackName(newStack.dataImage()),
                    properties.getRepositoryUrl(),
                    properties.getRepositoryReference(),
                    properties.getComposeFile(),
                    false,
                    env(newStack.dataImage(), newStack.coreImage(), newStack.port()));

            return api.createStack(request).map(created -> {
                log.info("Created stack {} (id={})", created.name(), created.id());
                if (created.resourceControl() == null) {
                    var warning = "Permissions not applied: stack " + created.name() + " has no resource control";
                    log.warn(warning);
                    return new MaybeWarnings<Unit>(Unit.unit(), List.of(warning));
                }
                var permission = toPermission(newStack.access(), newStack.teamIds(), newStack.userIds());
                return api.setPermission(created.resourceControl().id(), permission).<MaybeWarnings<Unit>>fold(
                        error -> {
                            log.warn("Permissions of stack {} not applied: {}", created.name(), error);
                            return new MaybeWarnings<Unit>(Unit.unit(), List.of("Permissions not applied: " + error));
                        },
                        ok -> MaybeWarnings.of(Unit.unit()));
            });
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public Result<Unit, String> update(D2Stack stack) {
        var api = holder.current();
        if (stack.resourceControlId() == 0) {
            return Result.failure("Stack " + stack.name() + " has no resource control");
        }
        var request = new UpdateStackRequest(env(stack.dataImage(), stack.coreImage(), stack.port()), false);
        var permission = toPermission(stack.access(), stack.teamIds(), stack.userIds());
        return api.updateStack(stack.id(), request)
                .flatMap(ok -> api.setPermission(stack.resourceControlId(), permission));
    }

    @Override
    public D2StackStats getStatsUrls(D2Stack stack) {
        var api = holder.current();
        Function<String, String> url = role -> {
            var containerId = stack.containerIds().get(role);
            return containerId == null
                    ? ""
                    : api.getBaseUrl() + "/#!/" + api.endpointId() + "/docker/containers/" + containerId + "/stats";
        };
        return new D2StackStats(url.apply("core"), url.apply("db"), url.apply("gateway"));
    }

    // -- Mapping --

    static D2Stack toD2Stack(Stack stack, List<Container> containers) {
        var containerIds = new LinkedHashMap<String, String>();
        boolean running = false;
        for (var container : containers) {
            if (!stack.name().equals(container.label(Container.COMPOSE_PROJECT_LABEL))) {
                continue;
            }
            var role = container.label(Container.COMPOSE_SERVICE_LABEL);
            containerIds.put(role.isEmpty() ? container.id() : role, container.id());
            running |= container.isRunning();
        }

        var control = stack.resourceControl();
        return new D2Stack(
                stack.id(),
                stack.name(),
                stack.envValue(DATA_IMAGE_ENV),
                stack.envValue(CORE_IMAGE_ENV),
                parsePort(stack.envValue(PORT_ENV)),
                running ? StackStatus.RUNNING : StackStatus.STOPPED,
                toAccess(control),
                control != null ? control.teamAccesses().stream().map(ResourceControl.TeamAccess::teamId)
                        .collect(Collectors.toList()) : List.of(),
                control != null ? control.userAccesses().stream().map(ResourceControl.UserAccess::userId)
                        .collect(Collectors.toList()) : List.of(),
                containerIds,
                control != null ? control.id() : 0);
    }

    static StackAccess toAccess(ResourceControl control) {
        if (control == null || control.isPublic()) {
            return StackAccess.PUBLIC;
        }
        return control.administratorsOnly() ? StackAccess.ADMIN : StackAccess.RESTRICTED;
    }

    static Permission toPermission(StackAccess access, List<Integer> teamIds, List<Integer> userIds) {
        switch (access) {
            case PUBLIC:
                return new Permission(false, true, List.of(), List.of());
            case ADMIN:
                return new Permission(true, false, List.of(), List.of());
            default:
                return new Permission(false, false, userIds, teamIds);
        }
    }

    /**
     * Compose project name derived from the data image, e.g.
     * {@code eyeseetea/dhis2-data:2.32-sierra} becomes {@code dhis2-data-2-32-sierra}.
     */
    static String stackName(String dataImage) {
        var repositoryAndTag = dataImage.substring(dataImage.lastIndexOf('/') + 1);
        return repositoryAndTag.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    static List<EnvVar> env(String dataImage, String coreImage, int port) {
        return List.of(
                new EnvVar(DATA_IMAGE_ENV, dataImage),
                new EnvVar(CORE_IMAGE_ENV, coreImage),
                new EnvVar(PORT_ENV, String.valueOf(port)));
    }

    static List<String> orderedContainerIds(D2Stack stack, boolean reverse) {
        var ordered = new ArrayList<String>();
        for (var role : SERVICE_ORDER) {
            var id = stack.containerIds().get(role);
            if (id != null) {
                ordered.add(id);
            }
        }
        stack.containerIds().forEach((role, id) -> {
            if (!SERVICE_ORDER.contains(role)) {
                ordered.add(id);
            }
        });
        if (reverse) {
            Collections.reverse(ordered);
        }
        return ordered;
    }

    private static Result<Unit, String> forEachContainer(List<String> containerIds,
                                                         Function<String, Result<Unit, String>> action) {
        for (var containerId : containerIds) {
            var result = action.apply(containerId);
            if (result.isFailure()) {
                return result;
            }
        }
        return Result.success(Unit.unit());
    }

    private static int parsePort(String value) {
        try {
            return value.isBlank() ? 0 : Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric port '{}'", value);
            return 0;
        }
    }

}
