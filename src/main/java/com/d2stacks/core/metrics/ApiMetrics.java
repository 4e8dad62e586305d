package com.d2stacks.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for calls against the control-plane API.
 */
public class ApiMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_HTTP_ERROR = "http_error";
    public static final String OUTCOME_TRANSPORT_ERROR = "transport_error";

    private final MeterRegistry registry;

    public ApiMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one HTTP round trip.
     *
     * @param method  HTTP method
     * @param outcome one of {@code success}, {@code http_error}, {@code transport_error}
     * @param elapsed wall-clock time of the call
     */
    public void recordRequest(String method, String outcome, Duration elapsed) {
        Timer.builder("d2stacks.api.requests")
                .description("Control-plane API round trips")
                .tag("method", method)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordLogin(boolean succeeded) {
        Counter.builder("d2stacks.logins")
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordStackDeleted() {
        Counter.builder("d2stacks.stacks.deleted")
                .register(registry)
                .increment();
    }
}
