package com.d2stacks.portainer;

import com.d2stacks.core.metrics.ApiMetrics;
import com.d2stacks.core.repository.D2StacksRepository;
import com.d2stacks.core.repository.DataSourceRepository;
import com.d2stacks.core.repository.MembershipRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Spring {@link Configuration} wiring the control-plane client and the repositories on top of it.
 * <p>
 * All repositories share one {@link PortainerApiHolder}, so a login performed through
 * {@link DataSourceRepository} is seen by every other repository.
 */
@Configuration
@EnableConfigurationProperties(PortainerProperties.class)
public class PortainerConfig {

    private static final Logger log = LoggerFactory.getLogger(PortainerConfig.class);

    /**
     * In-memory registry used when no monitoring backend contributes one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        log.debug("No MeterRegistry available; using in-memory SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    @Bean
    public ApiMetrics apiMetrics(MeterRegistry registry) {
        return new ApiMetrics(registry);
    }

    @Bean
    public HttpClient portainerHttpClient(PortainerProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
    }

    @Bean
    public PortainerTransport portainerTransport(HttpClient portainerHttpClient, ObjectMapper objectMapper,
                                                 PortainerProperties properties, ApiMetrics apiMetrics) {
        return new PortainerTransport(portainerHttpClient, objectMapper,
                Duration.ofSeconds(properties.getRequestTimeoutSeconds()), apiMetrics);
    }

    @Bean
    public PortainerApiHolder portainerApiHolder(PortainerProperties properties, PortainerTransport transport) {
        return new PortainerApiHolder(new PortainerApi(properties.getBaseUrl(), transport));
    }

    @Bean
    public DataSourceRepository dataSourceRepository(PortainerApiHolder holder) {
        return new PortainerDataSourceRepository(holder);
    }

    @Bean
    public MembershipRepository membershipRepository(PortainerApiHolder holder) {
        return new PortainerMembershipRepository(holder);
    }

    @Bean
    public D2StacksRepository d2StacksRepository(PortainerApiHolder holder, PortainerProperties properties) {
        return new PortainerD2StacksRepository(holder, properties);
    }
}
