package com.d2stacks.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Options restoring an existing session instead of logging in. Both fall back to
 * {@code d2stacks.portainer.token} and {@code d2stacks.portainer.endpoint-id}.
 */
public class SessionOptions {

    @Option(names = "--token", description = "Token issued by a previous login")
    String token;

    @Option(names = "--endpoint-id", description = "Endpoint id paired with --token")
    Integer endpointId;

    public SessionOptions() {
    }

    SessionOptions(String token, Integer endpointId) {
        this.token = token;
        this.endpointId = endpointId;
    }
}
