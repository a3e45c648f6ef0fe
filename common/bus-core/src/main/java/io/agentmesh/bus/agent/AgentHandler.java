package io.agentmesh.bus.agent;

import io.agentmesh.bus.model.Message;

/**
 * Message callback for agents registered without a dedicated {@link Agent} class.
 * Returning {@code null} means the agent produced no response.
 */
@FunctionalInterface
public interface AgentHandler {

  Message handle(Message message) throws Exception;
}
