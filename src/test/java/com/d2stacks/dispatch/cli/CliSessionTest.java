package com.d2stacks.dispatch.cli;

import com.d2stacks.core.model.UserSession;
import com.d2stacks.core.repository.DataSourceRepository;
import com.d2stacks.core.result.Result;
import com.d2stacks.portainer.PortainerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CliSessionTest {

    private DataSourceRepository dataSourceRepository;
    private PortainerProperties properties;
    private CliSession cliSession;

    @BeforeEach
    void setUp() {
        dataSourceRepository = mock(DataSourceRepository.class);
        properties = new PortainerProperties();
        properties.setBaseUrl("https://portainer.example.org");
        cliSession = new CliSession(dataSourceRepository, properties);
    }

    @Test
    @DisplayName("a missing base URL fails without contacting anything")
    void missingBaseUrl() {
        properties.setBaseUrl(" ");

        var result = cliSession.open(new SessionOptions());

        assertTrue(result.isFailure());
        assertTrue(result.failureError().orElseThrow().contains("base-url"));
        verifyNoInteractions(dataSourceRepository);
    }

    @Test
    @DisplayName("command line token and endpoint id restore the session")
    void restoreFromOptions() {
        properties.setUsername("admin");

        var result = cliSession.open(new SessionOptions("jwt", 7));

        assertEquals(Result.success(new UserSession("admin", "jwt", 7)), result);
        verify(dataSourceRepository).restore(new UserSession("admin", "jwt", 7));
        verify(dataSourceRepository, never()).login(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("configured token restores the session")
    void restoreFromProperties() {
        properties.setToken("jwt");
        properties.setEndpointId(2);

        assertTrue(cliSession.open(new SessionOptions()).isSuccess());
        verify(dataSourceRepository).restore(new UserSession("", "jwt", 2));
    }

    @Test
    @DisplayName("without a token the configured credentials log in")
    void loginWithCredentials() {
        properties.setUsername("admin");
        properties.setPassword("secret");
        properties.setEndpointName("local");
        when(dataSourceRepository.login("admin", "secret", "local"))
                .thenReturn(Result.success(new UserSession("admin", "jwt", 3)));

        assertEquals(Result.success(new UserSession("admin", "jwt", 3)), cliSession.open(new SessionOptions()));
    }

    @Test
    @DisplayName("a token without endpoint id falls back to credentials")
    void tokenWithoutEndpoint() {
        var result = cliSession.open(new SessionOptions("jwt", null));

        assertTrue(result.isFailure());
        verify(dataSourceRepository, never()).restore(org.mockito.ArgumentMatchers.any());
    }

    @Test
    @DisplayName("a command line token combines with the configured endpoint id")
    void optionTokenWithConfiguredEndpoint() {
        properties.setToken("stale");
        properties.setEndpointId(4);

        var result = cliSession.open(new SessionOptions("fresh", null));

        assertTrue(result.isSuccess());
        verify(dataSourceRepository).restore(new UserSession("", "fresh", 4));
    }

    @Test
    @DisplayName("a blank command line token does not fall back to the configured one")
    void blankOptionToken() {
        properties.setToken("jwt");
        properties.setEndpointId(4);

        var result = cliSession.open(new SessionOptions(" ", null));

        assertTrue(result.isFailure());
        verify(dataSourceRepository, never()).restore(org.mockito.ArgumentMatchers.any());
    }
}
