package io.agentmesh.bus.spring;

import io.agentmesh.bus.model.Message;

/**
 * Receives responses produced by the backlog pump. Declare a bean of this type to consume them;
 * without one they are logged at DEBUG.
 */
@FunctionalInterface
public interface BacklogResponseListener {

    void onResponse(Message response);
}
