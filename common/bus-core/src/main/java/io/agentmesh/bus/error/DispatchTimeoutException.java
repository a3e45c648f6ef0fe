package io.agentmesh.bus.error;

import java.time.Duration;

public final class DispatchTimeoutException extends AgentBusException {

  private final String agentId;
  private final Duration timeout;

  public DispatchTimeoutException(String agentId, Duration timeout) {
    super("Agent " + agentId + " timed out after " + timeout.toMillis() + "ms");
    this.agentId = agentId;
    this.timeout = timeout;
  }

  public String agentId() {
    return agentId;
  }

  public Duration timeout() {
    return timeout;
  }

  @Override
  public String errorType() {
    return "dispatch_timeout";
  }
}
