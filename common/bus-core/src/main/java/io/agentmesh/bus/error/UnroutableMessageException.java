package io.agentmesh.bus.error;

public final class UnroutableMessageException extends AgentBusException {

  public UnroutableMessageException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "unroutable";
  }
}
