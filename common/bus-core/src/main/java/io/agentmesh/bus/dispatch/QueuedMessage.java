package io.agentmesh.bus.dispatch;

import io.agentmesh.bus.model.Message;
import java.time.Instant;
import java.util.Objects;

public record QueuedMessage(Message message, Priority priority, Instant enqueuedAt) {

  public QueuedMessage {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
  }
}
