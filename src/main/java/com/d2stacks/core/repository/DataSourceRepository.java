package com.d2stacks.core.repository;

import com.d2stacks.core.model.UserSession;
import com.d2stacks.core.result.Result;

import java.util.Optional;

/**
 * Session lifecycle against the control plane.
 */
public interface DataSourceRepository {

    /**
     * Authenticates and selects {@code endpointName}; on success the session becomes current
     * for every other repository.
     */
    Result<UserSession, String> login(String username, String password, String endpointName);

    /**
     * Reinstates a session obtained earlier, without contacting the server.
     */
    void restore(UserSession session);

    void logout();

    Optional<UserSession> current();
}
