package io.agentmesh.bus.health;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolling probe statistics for one agent. Only the health monitor writes to it.
 */
public final class HealthTracker {

  public static final int DEFAULT_WINDOW = 20;

  private final int window;
  private final ArrayDeque<Sample> samples;
  private HealthStatus status = HealthStatus.HEALTHY;
  private Instant lastPing;

  public HealthTracker(int window) {
    if (window < 1) {
      throw new IllegalArgumentException("window must be >= 1");
    }
    this.window = window;
    this.samples = new ArrayDeque<>(window);
  }

  public synchronized void recordSuccess(Duration elapsed, Instant at) {
    record(true, elapsed, at);
  }

  public synchronized void recordFailure(Duration elapsed, Instant at) {
    record(false, elapsed, at);
  }

  public synchronized HealthRecord snapshot() {
    if (samples.isEmpty()) {
      return new HealthRecord(status, lastPing, List.of(), 0.0, 1.0);
    }
    List<Long> times = new ArrayList<>(samples.size());
    int successes = 0;
    for (Sample sample : samples) {
      times.add(sample.millis());
      if (sample.success()) {
        successes++;
      }
    }
    double total = samples.size();
    return new HealthRecord(status, lastPing, times, (total - successes) / total, successes / total);
  }

  private void record(boolean success, Duration elapsed, Instant at) {
    Objects.requireNonNull(elapsed, "elapsed");
    if (samples.size() == window) {
      samples.pollFirst();
    }
    samples.addLast(new Sample(elapsed.toMillis(), success));
    status = success ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
    lastPing = Objects.requireNonNull(at, "at");
  }

  private record Sample(long millis, boolean success) {
  }
}
