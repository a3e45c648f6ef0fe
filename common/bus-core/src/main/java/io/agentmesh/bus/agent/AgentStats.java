package io.agentmesh.bus.agent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-agent dispatch counters.
 */
public final class AgentStats {

  private final AtomicLong received = new AtomicLong();
  private final AtomicLong sent = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong totalResponseNanos = new AtomicLong();

  public void recordReceived() {
    received.incrementAndGet();
  }

  public void recordResponse(long elapsedNanos, boolean produced) {
    completed.incrementAndGet();
    totalResponseNanos.addAndGet(Math.max(0L, elapsedNanos));
    if (produced) {
      sent.incrementAndGet();
    }
  }

  public void recordError() {
    errors.incrementAndGet();
  }

  public Snapshot snapshot() {
    long done = completed.get();
    double avgMillis = done == 0 ? 0.0 : totalResponseNanos.get() / (double) done / 1_000_000.0;
    return new Snapshot(received.get(), sent.get(), errors.get(), avgMillis);
  }

  public record Snapshot(long messagesReceived, long messagesSent, long errors, double averageResponseMillis) {
  }
}
