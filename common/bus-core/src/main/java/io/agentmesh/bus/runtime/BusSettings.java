package io.agentmesh.bus.runtime;

import io.agentmesh.bus.breaker.CircuitBreakerSettings;
import io.agentmesh.bus.context.SharedContext;
import io.agentmesh.bus.events.EventLog;
import io.agentmesh.bus.health.HealthMonitor;
import io.agentmesh.bus.health.HealthTracker;
import io.agentmesh.bus.pipeline.PipelineTracker;
import java.time.Duration;
import java.util.Objects;

public record BusSettings(
    CircuitBreakerSettings breaker,
    Duration dispatchTimeout,
    Duration healthCheckTimeout,
    int healthWindow,
    int eventLogCapacity,
    int pipelineArchiveLimit,
    int sharedContextLimit
) {

  public static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofSeconds(30);

  public BusSettings {
    Objects.requireNonNull(breaker, "breaker");
    requirePositive(dispatchTimeout, "dispatchTimeout");
    requirePositive(healthCheckTimeout, "healthCheckTimeout");
    requireAtLeastOne(healthWindow, "healthWindow");
    requireAtLeastOne(eventLogCapacity, "eventLogCapacity");
    requireAtLeastOne(pipelineArchiveLimit, "pipelineArchiveLimit");
    requireAtLeastOne(sharedContextLimit, "sharedContextLimit");
  }

  public static BusSettings defaults() {
    return new BusSettings(
        CircuitBreakerSettings.defaults(),
        DEFAULT_DISPATCH_TIMEOUT,
        HealthMonitor.DEFAULT_TIMEOUT,
        HealthTracker.DEFAULT_WINDOW,
        EventLog.DEFAULT_CAPACITY,
        PipelineTracker.DEFAULT_ARCHIVE_LIMIT,
        SharedContext.DEFAULT_MAX_ENTRIES);
  }

  public BusSettings withBreaker(CircuitBreakerSettings value) {
    return new BusSettings(value, dispatchTimeout, healthCheckTimeout, healthWindow,
        eventLogCapacity, pipelineArchiveLimit, sharedContextLimit);
  }

  public BusSettings withDispatchTimeout(Duration value) {
    return new BusSettings(breaker, value, healthCheckTimeout, healthWindow,
        eventLogCapacity, pipelineArchiveLimit, sharedContextLimit);
  }

  public BusSettings withHealthCheckTimeout(Duration value) {
    return new BusSettings(breaker, dispatchTimeout, value, healthWindow,
        eventLogCapacity, pipelineArchiveLimit, sharedContextLimit);
  }

  public BusSettings withEventLogCapacity(int value) {
    return new BusSettings(breaker, dispatchTimeout, healthCheckTimeout, healthWindow,
        value, pipelineArchiveLimit, sharedContextLimit);
  }

  private static void requirePositive(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(field + " must be positive");
    }
  }

  private static void requireAtLeastOne(int value, String field) {
    if (value < 1) {
      throw new IllegalArgumentException(field + " must be >= 1");
    }
  }
}
