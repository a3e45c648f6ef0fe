package io.agentmesh.bus.error;

public final class CircuitOpenException extends AgentBusException {

  private final String agentId;

  public CircuitOpenException(String agentId) {
    super("Circuit breaker OPEN for agent " + agentId);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }

  @Override
  public String errorType() {
    return "circuit_open";
  }
}
