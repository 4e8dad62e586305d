package com.d2stacks.portainer;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Control-plane connection settings bound from {@code d2stacks.portainer.*}.
 * <p>
 * Either {@code token} + {@code endpointId} (to restore a session) or
 * {@code username} + {@code password} + {@code endpointName} (to log in) must be set
 * for commands that need a session.
 */
@ConfigurationProperties(prefix = "d2stacks.portainer")
public class PortainerProperties {

    /** Portainer URL without the /api suffix, e.g. https://portainer.example.org */
    private String baseUrl = "";

    private String username = "";

    private String password = "";

    /** Name of the endpoint (Docker host) stacks are managed on */
    private String endpointName = "";

    /** Previously issued token; restores a session without logging in */
    private String token = "";

    /** Endpoint id paired with {@code token} */
    private int endpointId = 0;

    private int connectTimeoutSeconds = 10;

    private int requestTimeoutSeconds = 30;

    /** Git repository holding the DHIS2 compose file new stacks are deployed from */
    private String repositoryUrl = "https://github.com/EyeSeeTea/d2-docker";

    private String repositoryReference = "refs/heads/master";

    private String composeFile = "docker-compose.yml";

    /**
     * Whether a token and endpoint id, possibly overridden on the command line, can restore a session.
     */
    public static boolean hasToken(String token, int endpointId) {
        return token != null && !token.isBlank() && endpointId > 0;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank()
                && password != null && !password.isBlank()
                && endpointName != null && !endpointName.isBlank();
    }

    // -- Getters and Setters --

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getEndpointName() {
        return endpointName;
    }

    public void setEndpointName(String endpointName) {
        this.endpointName = endpointName;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public int getEndpointId() {
        return endpointId;
    }

    public void setEndpointId(int endpointId) {
        this.endpointId = endpointId;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public void setRepositoryUrl(String repositoryUrl) {
        this.repositoryUrl = repositoryUrl;
    }

    public String getRepositoryReference() {
        return repositoryReference;
    }

    public void setRepositoryReference(String repositoryReference) {
        this.repositoryReference = repositoryReference;
    }

    public String getComposeFile() {
        return composeFile;
    }

    public void setComposeFile(String composeFile) {
        this.composeFile = composeFile;
    }
}
