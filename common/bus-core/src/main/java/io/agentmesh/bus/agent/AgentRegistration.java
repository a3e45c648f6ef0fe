package io.agentmesh.bus.agent;

import io.agentmesh.bus.breaker.CircuitBreaker;
import io.agentmesh.bus.health.HealthTracker;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry: the agent plus the state the bus keeps about it.
 */
public final class AgentRegistration {

  private final Agent agent;
  private final CircuitBreaker breaker;
  private final HealthTracker health;
  private final AgentStats stats = new AgentStats();
  private final AtomicBoolean active = new AtomicBoolean(true);
  private final Instant registeredAt;

  public AgentRegistration(Agent agent, CircuitBreaker breaker, HealthTracker health, Instant registeredAt) {
    this.agent = Objects.requireNonNull(agent, "agent");
    this.breaker = Objects.requireNonNull(breaker, "breaker");
    this.health = Objects.requireNonNull(health, "health");
    this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");
  }

  public String agentId() {
    return agent.id();
  }

  public String role() {
    return agent.role();
  }

  public Agent agent() {
    return agent;
  }

  public CircuitBreaker breaker() {
    return breaker;
  }

  public HealthTracker health() {
    return health;
  }

  public AgentStats stats() {
    return stats;
  }

  public boolean isActive() {
    return active.get();
  }

  public void setActive(boolean value) {
    active.set(value);
  }

  public Instant registeredAt() {
    return registeredAt;
  }

  public AgentSnapshot snapshot() {
    return new AgentSnapshot(agentId(), role(), isActive(), registeredAt, breaker.state(), stats.snapshot());
  }
}
