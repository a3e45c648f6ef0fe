package io.agentmesh.bus.health;

import java.time.Instant;
import java.util.List;

/**
 * Health view of one agent.
 *
 * @param status        outcome of the latest probe
 * @param lastPing      when the latest probe finished, {@code null} before the first one
 * @param responseTimes rolling window of probe durations in milliseconds, oldest first
 * @param errorRate     failed probes over probes in the window
 * @param availability  successful probes over probes in the window
 */
public record HealthRecord(
    HealthStatus status,
    Instant lastPing,
    List<Long> responseTimes,
    double errorRate,
    double availability
) {

  public HealthRecord {
    responseTimes = responseTimes == null ? List.of() : List.copyOf(responseTimes);
  }

  public static HealthRecord initial() {
    return new HealthRecord(HealthStatus.HEALTHY, null, List.of(), 0.0, 1.0);
  }
}
