package io.agentmesh.bus.runtime;

import io.agentmesh.bus.dispatch.Priority;
import io.agentmesh.bus.model.Message;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The view of the bus handed to agents on registration.
 */
public interface AgentBus {

  default Message route(Message message) {
    return route(message, Priority.NORMAL);
  }

  /**
   * Queues the message and processes the head of the highest non-empty lane. Operational
   * failures come back as error-kind messages rather than exceptions.
   */
  Message route(Message message, Priority priority);

  void enqueue(Message message, Priority priority);

  /**
   * Sends a notification to every active agent and returns the non-null responses.
   */
  List<Message> broadcast(String method, Map<String, Object> params);

  Optional<Object> contextValue(String key);

  void putContext(String key, Object value);
}
