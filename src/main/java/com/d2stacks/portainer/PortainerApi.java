package com.d2stacks.portainer;

import com.d2stacks.core.logging.MdcContext;
import com.d2stacks.core.result.Result;
import com.d2stacks.core.result.Unit;
import com.d2stacks.portainer.model.AuthResponse;
import com.d2stacks.portainer.model.Container;
import com.d2stacks.portainer.model.Credentials;
import com.d2stacks.portainer.model.Endpoint;
import com.d2stacks.portainer.model.Permission;
import com.d2stacks.portainer.model.PostStackRequest;
import com.d2stacks.portainer.model.PostStackResponse;
import com.d2stacks.portainer.model.Stack;
import com.d2stacks.portainer.model.Team;
import com.d2stacks.portainer.model.UpdateStackRequest;
import com.d2stacks.portainer.model.User;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Authenticated client for the Portainer control-plane API.
 *
 * <p>Every operation is a blocking round trip returning a {@link Result}; only
 * reading session data while not logged in throws ({@link NotLoggedException}).
 *
 * <p>The two ways into a logged-in client differ:
 * <ul>
 *   <li>{@link #login} negotiates with the server and returns a <em>new</em> client;
 *       this instance is left untouched and callers must adopt the returned one.</li>
 *   <li>{@link #setSession} and {@link #clearSession} overwrite this instance's state
 *       in place, trusting the caller's token.</li>
 * </ul>
 *
 * <p>The session field is not synchronized; callers serialize use of one instance.
 */
public class PortainerApi {

    private static final Logger log = LoggerFactory.getLogger(PortainerApi.class);

    private static final TypeReference<AuthResponse> AUTH_RESPONSE = new TypeReference<>() {};
    private static final TypeReference<List<Endpoint>> ENDPOINTS = new TypeReference<>() {};
    private static final TypeReference<List<Stack>> STACKS = new TypeReference<>() {};
    private static final TypeReference<Stack> STACK = new TypeReference<>() {};
    private static final TypeReference<PostStackResponse> POST_STACK_RESPONSE = new TypeReference<>() {};
    private static final TypeReference<List<Container>> CONTAINERS = new TypeReference<>() {};
    private static final TypeReference<List<Team>> TEAMS = new TypeReference<>() {};
    private static final TypeReference<List<User>> USERS = new TypeReference<>() {};

    /** Deployment method and stack type of compose stacks pulled from a git repository. */
    private static final String CREATE_METHOD = "repository";
    private static final int COMPOSE_STACK_TYPE = 2;

    private final String baseUrl;
    private final String apiUrl;
    private final PortainerTransport transport;
    private SessionState state;

    public PortainerApi(String baseUrl, PortainerTransport transport) {
        this(baseUrl, transport, SessionState.notLogged());
    }

    private PortainerApi(String baseUrl, PortainerTransport transport, SessionState state) {
        this.baseUrl = stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.apiUrl = this.baseUrl + "/api";
        this.transport = transport;
        this.state = state;
    }

    // -- Session --

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public SessionState state() {
        return state;
    }

    public boolean isLoggedIn() {
        return state.isLogged();
    }

    /**
     * @throws NotLoggedException when no session is active
     */
    public String token() {
        return state.requireLogged().token();
    }

    /**
     * @throws NotLoggedException when no session is active
     */
    public int endpointId() {
        return state.requireLogged().endpointId();
    }

    /**
     * Restores a previously obtained session on this instance without contacting the server.
     */
    public void setSession(String token, int endpointId) {
        this.state = SessionState.logged(token, endpointId);
    }

    public void clearSession() {
        this.state = SessionState.notLogged();
    }

    /**
     * Exchanges credentials for a token, then resolves {@code endpointName} to its id.
     *
     * <p>The endpoint listing is authorized with the freshly issued token and is never
     * attempted when the credential exchange fails. An endpoint name that does not
     * match exactly is a failure even though both calls succeeded.
     *
     * @return a new client in the logged state; this instance is not modified
     */
    public Result<PortainerApi, String> login(String username, String password, String endpointName) {
        MdcContext.setOperation("login");
        try {
            var result = authenticate(username, password)
                    .flatMap(token -> resolveEndpoint(token, endpointName)
                            .map(endpoint -> new PortainerApi(baseUrl, transport,
                                    SessionState.logged(token, endpoint.id()))));
            transport.metrics().recordLogin(result.isSuccess());
            if (result.isSuccess()) {
                log.info("Logged in as '{}' on endpoint '{}' (id={})",
                        username, endpointName, result.orElseThrow().endpointId());
            } else {
                log.warn("Login of '{}' failed: {}", username, result.failureError().orElse(""));
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private Result<String, String> authenticate(String username, String password) {
        var uri = resolve("/auth", Map.of());
        return uri.flatMap(u -> transport.send("POST", u, new Credentials(username, password), Optional.empty()))
                .flatMap(body -> transport.decode(body, AUTH_RESPONSE))
                .flatMap(response -> response.jwt() == null || response.jwt().isBlank()
                        ? Result.<String, String>failure("Cannot login")
                        : Result.<String, String>success(response.jwt()));
    }

    private Result<Endpoint, String> resolveEndpoint(String token, String endpointName) {
        return request("GET", "/endpoints", Map.of(), null, token, ENDPOINTS)
                .flatMap(endpoints -> endpoints.stream()
                        .filter(endpoint -> endpointName.equals(endpoint.name()))
                        .findFirst()
                        .map(Result::<Endpoint, String>success)
                        .orElseGet(() -> Result.failure("Cannot find endpoint '" + endpointName + "'")));
    }

    // -- Stacks --

    /**
     * Lists the stacks deployed on the session's endpoint. The server returns stacks of
     * every endpoint, so the listing is filtered here by exact endpoint id.
     */
    public Result<List<Stack>, String> getStacks() {
        int endpointId = endpointId();
        return request("GET", "/stacks", STACKS)
                .map(stacks -> stacks.stream()
                        .filter(stack -> stack.endpointId() == endpointId)
                        .collect(Collectors.toList()));
    }

    public Result<Stack, String> getStack(int id) {
        return request("GET", "/stacks/" + id, STACK);
    }

    public Result<PostStackResponse, String> createStack(PostStackRequest stackRequest) {
        int endpointId = endpointId();
        var params = new LinkedHashMap<String, Object>();
        params.put("endpointId", endpointId);
        params.put("method", CREATE_METHOD);
        params.put("type", COMPOSE_STACK_TYPE);
        return send("POST", "/stacks", params, stackRequest, null)
                .flatMap(raw -> raw.isBlank()
                        ? Result.<PostStackResponse, String>success(createdWithoutBody(stackRequest, endpointId))
                        : transport.decode(raw, POST_STACK_RESPONSE));
    }

    // the stack exists but its id and resource control are unknown
    private PostStackResponse createdWithoutBody(PostStackRequest stackRequest, int endpointId) {
        log.warn("Stack {} created but the response carried no body", stackRequest.name());
        return new PostStackResponse(0, stackRequest.name(), endpointId, null);
    }

    public Result<Unit, String> updateStack(int id, UpdateStackRequest stackRequest) {
        return requestVoid("PUT", "/stacks/" + id, Map.of("endpointId", endpointId()), stackRequest);
    }

    /**
     * Deletes the given stacks one at a time, in order, stopping at the first failure.
     *
     * <p>A failure means a strict prefix of {@code ids} may already be gone while the
     * rest were never attempted; re-query to learn which. Nothing is rolled back.
     */
    public Result<Unit, String> deleteStacks(List<Integer> ids) {
        for (int id : ids) {
            var result = requestVoid("DELETE", "/stacks/" + id, Map.of(), null);
            if (result.isFailure()) {
                log.warn("Stopped batch delete at stack {}: {}", id, result.failureError().orElse(""));
                return result;
            }
            transport.metrics().recordStackDeleted();
            log.info("Deleted stack {}", id);
        }
        return Result.success(Unit.unit());
    }

    /**
     * Replaces the permission of a resource control; the previous one is not merged.
     */
    public Result<Unit, String> setPermission(int resourceId, Permission permission) {
        return requestVoid("PUT", "/resource_controls/" + resourceId, Map.of(), permission);
    }

    // -- Containers --

    /**
     * @param all include stopped containers
     */
    public Result<List<Container>, String> getContainers(boolean all) {
        return request("GET", containersPath() + "/json", Map.of("all", all), null, null, CONTAINERS);
    }

    public Result<Unit, String> startContainer(String containerId) {
        return requestVoid("POST", containersPath() + "/" + containerId + "/start", Map.of(), null);
    }

    public Result<Unit, String> stopContainer(String containerId) {
        return requestVoid("POST", containersPath() + "/" + containerId + "/stop", Map.of(), null);
    }

    // -- Membership --

    public Result<List<Team>, String> getTeams() {
        return request("GET", "/teams", TEAMS);
    }

    public Result<List<User>, String> getUsers() {
        return request("GET", "/users", USERS);
    }

    // -- Request plumbing --

    private String containersPath() {
        return "/endpoints/" + endpointId() + "/docker/containers";
    }

    private <T> Result<T, String> request(String method, String path, TypeReference<T> type) {
        return request(method, path, Map.of(), null, null, type);
    }

    private <T> Result<T, String> request(String method, String path, Map<String, ?> params,
                                          Object body, String token, TypeReference<T> type) {
        return send(method, path, params, body, token)
                .flatMap(raw -> transport.decode(raw, type));
    }

    private Result<Unit, String> requestVoid(String method, String path, Map<String, ?> params, Object body) {
        return send(method, path, params, body, null).map(raw -> Unit.unit());
    }

    /**
     * An explicit token wins over the session token; without either the call is anonymous.
     */
    private Result<String, String> send(String method, String path, Map<String, ?> params,
                                        Object body, String token) {
        Optional<String> bearer = token != null
                ? Optional.of(token)
                : state.fold(Optional::empty, logged -> Optional.of(logged.token()));
        return resolve(path, params)
                .flatMap(uri -> transport.send(method, uri, body, bearer));
    }

    Result<URI, String> resolve(String path, Map<String, ?> params) {
        var url = path.startsWith("http://") || path.startsWith("https://")
                ? path
                : apiUrl + (path.startsWith("/") ? path : "/" + path);
        if (!params.isEmpty()) {
            url += (url.contains("?") ? "&" : "?") + params.entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
                    .collect(Collectors.joining("&"));
        }
        try {
            return Result.success(URI.create(url));
        } catch (IllegalArgumentException e) {
            return Result.failure("Invalid URL " + url + ": " + ApiErrors.transportFailure(e));
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlashes(String url) {
        var end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }
}
