package io.agentmesh.bus.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-agent breaker tuning.
 *
 * @param failureThreshold         failures that trip a closed breaker
 * @param recoveryTimeout          time an open breaker refuses dispatch before allowing a probe
 * @param halfOpenSuccessThreshold consecutive probe successes needed to close again
 */
public record CircuitBreakerSettings(int failureThreshold,
                                     Duration recoveryTimeout,
                                     int halfOpenSuccessThreshold) {

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_HALF_OPEN_SUCCESS_THRESHOLD = 3;

  public CircuitBreakerSettings {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
    if (recoveryTimeout.isNegative()) {
      throw new IllegalArgumentException("recoveryTimeout must be >= 0");
    }
    if (halfOpenSuccessThreshold < 1) {
      throw new IllegalArgumentException("halfOpenSuccessThreshold must be >= 1");
    }
  }

  public static CircuitBreakerSettings defaults() {
    return new CircuitBreakerSettings(
        DEFAULT_FAILURE_THRESHOLD,
        DEFAULT_RECOVERY_TIMEOUT,
        DEFAULT_HALF_OPEN_SUCCESS_THRESHOLD);
  }

  public CircuitBreakerSettings withFailureThreshold(int threshold) {
    return new CircuitBreakerSettings(threshold, recoveryTimeout, halfOpenSuccessThreshold);
  }
}
