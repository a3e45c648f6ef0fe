package io.agentmesh.bus.agent;

import io.agentmesh.bus.breaker.CircuitState;
import java.time.Instant;

public record AgentSnapshot(
    String agentId,
    String role,
    boolean active,
    Instant registeredAt,
    CircuitState circuitState,
    AgentStats.Snapshot stats
) {
}
