package com.boilerplate.model;

import java.time.Instant;

public record HealthStatus(
    String status,
    String database,
    String application,
    Instant timestamp
) {
    public static HealthStatus healthy(Instant timestamp) {
        return new HealthStatus("healthy", "connected", "running", timestamp);
    }
}
