package io.agentmesh.bus.runtime;

import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.model.Message;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Agent that replies with {@code handled_<id>} and remembers what it saw. It can be told to fail.
 */
final class RecordingAgent implements Agent {

  private final String id;
  private final String role;
  private final List<Message> received = new CopyOnWriteArrayList<>();
  private final AtomicBoolean failing = new AtomicBoolean();
  private volatile boolean silent;
  private volatile AgentBus bus;

  RecordingAgent(String id, String role) {
    this.id = id;
    this.role = role;
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
  public Message handle(Message message) {
    received.add(message);
    if (failing.get()) {
      throw new IllegalStateException(id + " is failing");
    }
    if (silent) {
      return null;
    }
    return message.reply("handled", "handled", Map.of("agent", id, "request", message.id()));
  }

  @Override
  public void onRegister(AgentBus bus) {
    this.bus = bus;
  }

  RecordingAgent failing(boolean value) {
    failing.set(value);
    return this;
  }

  RecordingAgent silent() {
    silent = true;
    return this;
  }

  List<Message> received() {
    return received;
  }

  int invocations() {
    return received.size();
  }

  void clear() {
    received.clear();
  }

  AgentBus bus() {
    return bus;
  }
}
