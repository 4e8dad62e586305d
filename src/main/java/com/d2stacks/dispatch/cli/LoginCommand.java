package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.DataSourceRepository;
import com.d2stacks.portainer.PortainerProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks login
 * <p>
 * Runs the login handshake and prints the token and endpoint id, which later
 * commands accept through {@code --token} and {@code --endpoint-id}.
 */
@Command(name = "login", mixinStandardHelpOptions = true, description = "Log in and print a reusable session")
@Component
public class LoginCommand implements Callable<Integer> {

    @Option(names = {"--username", "-u"}, description = "User name (default: d2stacks.portainer.username)")
    private String username;

    @Option(names = {"--password", "-p"}, description = "Password (default: d2stacks.portainer.password)",
            interactive = true, arity = "0..1")
    private String password;

    @Option(names = {"--endpoint", "-e"}, description = "Endpoint name (default: d2stacks.portainer.endpoint-name)")
    private String endpointName;

    private final DataSourceRepository dataSourceRepository;
    private final PortainerProperties properties;

    public LoginCommand(DataSourceRepository dataSourceRepository, PortainerProperties properties) {
        this.dataSourceRepository = dataSourceRepository;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            ConsoleOutput.error("No Portainer URL configured (d2stacks.portainer.base-url)");
            return 1;
        }

        String user = username != null ? username : properties.getUsername();
        String secret = password != null ? password : properties.getPassword();
        String endpoint = endpointName != null ? endpointName : properties.getEndpointName();

        ConsoleOutput.info("Logging in to " + properties.getBaseUrl() + " as " + user);
        return dataSourceRepository.login(user, secret, endpoint).fold(
                error -> {
                    ConsoleOutput.error("Login failed: " + error);
                    return 1;
                },
                session -> {
                    ConsoleOutput.success("Logged in on endpoint '" + endpoint + "' (id " + session.endpointId() + ")");
                    System.out.println("  Token:       " + session.token());
                    System.out.println("  Endpoint id: " + session.endpointId());
                    return 0;
                });
    }
}
