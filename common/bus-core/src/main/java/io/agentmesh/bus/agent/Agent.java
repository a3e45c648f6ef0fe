package io.agentmesh.bus.agent;

import io.agentmesh.bus.model.Message;
import io.agentmesh.bus.runtime.AgentBus;
import java.util.Objects;

/**
 * A unit of work reachable through the bus.
 * <p>
 * The bus keeps a reference to each registered agent and never touches its internal state. It
 * routes messages addressed to {@link #id()} directly and fans out recipient-less messages to
 * every agent whose {@link #role()} equals the message method.
 */
public interface Agent {

  String id();

  String role();

  /**
   * Handles a message. May return {@code null} when there is nothing to answer. Thrown
   * exceptions are recorded as failures against the agent's circuit breaker.
   */
  Message handle(Message message) throws Exception;

  default void onRegister(AgentBus bus) {
  }

  default void onUnregister() {
  }

  static Agent of(String id, String role, AgentHandler handler) {
    return new HandlerAgent(id, role, handler);
  }

  final class HandlerAgent implements Agent {

    private final String id;
    private final String role;
    private final AgentHandler handler;

    private HandlerAgent(String id, String role, AgentHandler handler) {
      this.id = AgentRegistry.requireText(id, "agentId");
      this.role = AgentRegistry.requireText(role, "role");
      this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public String role() {
      return role;
    }

    @Override
    public Message handle(Message message) throws Exception {
      return handler.handle(message);
    }

    @Override
    public String toString() {
      return "HandlerAgent[" + id + "/" + role + "]";
    }
  }
}
