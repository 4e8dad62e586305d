package com.d2stacks.core.model;

public record UserSession(String username, String token, int endpointId) {

    @Override
    public String toString() {
        return "UserSession[username=" + username + ", endpointId=" + endpointId + "]";
    }
}
