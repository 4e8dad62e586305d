package com.d2stacks.portainer;

import com.d2stacks.core.model.UserSession;
import com.d2stacks.core.repository.DataSourceRepository;
import com.d2stacks.core.result.Result;

import java.util.Optional;

public class PortainerDataSourceRepository implements DataSourceRepository {

    private final PortainerApiHolder holder;
    private String username = "";

    public PortainerDataSourceRepository(PortainerApiHolder holder) {
        this.holder = holder;
    }

    @Override
    public Result<UserSession, String> login(String username, String password, String endpointName) {
        return holder.current().login(username, password, endpointName)
                .map(api -> {
                    holder.adopt(api);
                    this.username = username;
                    return new UserSession(username, api.token(), api.endpointId());
                });
    }

    @Override
    public void restore(UserSession session) {
        holder.current().setSession(session.token(), session.endpointId());
        this.username = session.username() != null ? session.username() : "";
    }

    @Override
    public void logout() {
        holder.current().clearSession();
        this.username = "";
    }

    @Override
    public Optional<UserSession> current() {
        return holder.current().state().fold(
                Optional::empty,
                logged -> Optional.of(new UserSession(username, logged.token(), logged.endpointId())));
    }
}
