package io.agentmesh.bus.error;

/**
 * Base type for operational dispatch failures. The controller converts these into
 * error-kind messages at the dispatch boundary instead of throwing them to callers.
 */
public abstract class AgentBusException extends RuntimeException {

  protected AgentBusException(String message) {
    super(message);
  }

  protected AgentBusException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Stable code carried in the {@code error_type} parameter of error messages.
   */
  public abstract String errorType();
}
