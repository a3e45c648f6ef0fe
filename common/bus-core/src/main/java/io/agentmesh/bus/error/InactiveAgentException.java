package io.agentmesh.bus.error;

public final class InactiveAgentException extends AgentBusException {

  private final String agentId;

  public InactiveAgentException(String agentId) {
    super("Agent " + agentId + " is not active");
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }

  @Override
  public String errorType() {
    return "agent_inactive";
  }
}
