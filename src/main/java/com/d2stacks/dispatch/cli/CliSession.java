package com.d2stacks.dispatch.cli;

import com.d2stacks.core.model.UserSession;
import com.d2stacks.core.repository.DataSourceRepository;
import com.d2stacks.core.result.Result;
import com.d2stacks.portainer.PortainerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens the session a command runs in.
 * <p>
 * A token with its endpoint id, from the command line or configuration, is restored as is
 * without contacting the server. Otherwise the configured credentials go through the login
 * handshake. The token is never written anywhere.
 */
@Component
public class CliSession {

    private static final Logger log = LoggerFactory.getLogger(CliSession.class);

    private final DataSourceRepository dataSourceRepository;
    private final PortainerProperties properties;

    public CliSession(DataSourceRepository dataSourceRepository, PortainerProperties properties) {
        this.dataSourceRepository = dataSourceRepository;
        this.properties = properties;
    }

    public Result<UserSession, String> open(SessionOptions options) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            return Result.failure("No Portainer URL configured (d2stacks.portainer.base-url)");
        }

        String token = options != null && options.token != null ? options.token : properties.getToken();
        int endpointId = options != null && options.endpointId != null
                ? options.endpointId
                : properties.getEndpointId();
        if (PortainerProperties.hasToken(token, endpointId)) {
            log.debug("Restoring session on endpoint {}", endpointId);
            var session = new UserSession(properties.getUsername(), token, endpointId);
            dataSourceRepository.restore(session);
            return Result.success(session);
        }

        if (properties.hasCredentials()) {
            return dataSourceRepository.login(
                    properties.getUsername(), properties.getPassword(), properties.getEndpointName());
        }
        return Result.failure("No session: set a token with its endpoint id, "
                + "or a username, password and endpoint name");
    }
}
