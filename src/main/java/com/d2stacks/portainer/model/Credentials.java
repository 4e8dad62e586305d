package com.d2stacks.portainer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Credentials(
    @JsonProperty("Username") String username,
    @JsonProperty("Password") String password
) {

    @Override
    public String toString() {
        return "Credentials[username=" + username + "]";
    }
}
