package io.agentmesh.bus.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 */
public record CircuitBreakerSnapshot(
    String agentId,
    CircuitState state,
    int failureCount,
    int failureThreshold,
    Duration recoveryTimeout,
    Instant lastFailureTime,
    int halfOpenSuccesses
) {
}
