package io.agentmesh.bus.runtime;

import io.agentmesh.bus.agent.AgentStats;
import io.agentmesh.bus.breaker.CircuitBreakerSnapshot;
import io.agentmesh.bus.dispatch.Priority;
import io.agentmesh.bus.health.HealthRecord;
import io.agentmesh.bus.pipeline.PipelineTracker;
import java.util.Map;

/**
 * Point-in-time controller statistics.
 */
public record BusMetrics(
    long totalMessages,
    long successfulRoutes,
    long failedRoutes,
    double averageLatencyMillis,
    int registeredAgents,
    long activeAgents,
    long breakerTrips,
    Map<Priority, Integer> laneSizes,
    int eventLogSize,
    Map<String, AgentStats.Snapshot> agents,
    Map<String, CircuitBreakerSnapshot> circuitBreakers,
    Map<String, HealthRecord> agentHealth,
    PipelineTracker.Counts pipelines,
    int sharedContextSize,
    boolean running
) {

  public BusMetrics {
    laneSizes = Map.copyOf(laneSizes);
    agents = Map.copyOf(agents);
    circuitBreakers = Map.copyOf(circuitBreakers);
    agentHealth = Map.copyOf(agentHealth);
  }
}
