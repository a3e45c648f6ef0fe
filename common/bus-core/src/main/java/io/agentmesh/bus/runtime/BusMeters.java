package io.agentmesh.bus.runtime;

import io.agentmesh.bus.dispatch.PriorityLanes;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Publishes bus activity to Micrometer.
 */
final class BusMeters {

  private final MeterRegistry registry;
  private final Timer routeLatency;

  BusMeters(MeterRegistry registry, PriorityLanes lanes) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.routeLatency = Timer.builder("agentmesh.bus.route.latency")
        .description("Time spent processing one routed message")
        .register(registry);
    Gauge.builder("agentmesh.bus.queue.size", lanes, PriorityLanes::size)
        .description("Messages waiting in the priority lanes")
        .register(registry);
  }

  void recordRoute(boolean success, long elapsedNanos) {
    Counter.builder("agentmesh.bus.messages")
        .description("Messages processed by the bus")
        .tag("outcome", outcome(success))
        .register(registry)
        .increment();
    routeLatency.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  void recordDispatch(String agentId, boolean success, long elapsedNanos) {
    Timer.builder("agentmesh.bus.dispatch.duration")
        .description("Latency of agent handler invocations")
        .tag("agent", agentId)
        .tag("outcome", outcome(success))
        .register(registry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  void recordTrip(String agentId) {
    Counter.builder("agentmesh.bus.breaker.trips")
        .description("Circuit breaker transitions to OPEN")
        .tag("agent", agentId)
        .register(registry)
        .increment();
  }

  private static String outcome(boolean success) {
    return success ? "success" : "error";
  }
}
