package io.agentmesh.bus.error;

/**
 * Raised when an agent handler throws while processing a message.
 */
public final class AgentHandlerException extends AgentBusException {

  private final String agentId;

  public AgentHandlerException(String agentId, Throwable cause) {
    super("Agent " + agentId + " failed: " + describe(cause), cause);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }

  @Override
  public String errorType() {
    return "handler_failed";
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
