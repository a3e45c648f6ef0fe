package io.agentmesh.bus.spring;

import io.agentmesh.bus.breaker.CircuitBreakerSettings;
import io.agentmesh.bus.context.SharedContext;
import io.agentmesh.bus.events.EventLog;
import io.agentmesh.bus.health.HealthMonitor;
import io.agentmesh.bus.health.HealthTracker;
import io.agentmesh.bus.pipeline.PipelineTracker;
import io.agentmesh.bus.runtime.BacklogPump;
import io.agentmesh.bus.runtime.BusSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised tuning for the agent bus. Every property is optional and falls back to the
 * defaults of the core components.
 */
@ConfigurationProperties(prefix = "agentmesh.bus")
public final class AgentBusProperties {

    private static final String PREFIX = "agentmesh.bus.";

    private final boolean enabled;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenSuccessThreshold;
    private final Duration dispatchTimeout;
    private final Duration healthCheckTimeout;
    private final int healthWindow;
    private final int eventLogCapacity;
    private final int pipelineArchiveLimit;
    private final int sharedContextLimit;
    private final Pump pump;

    public AgentBusProperties(Boolean enabled,
                              Integer failureThreshold,
                              Duration recoveryTimeout,
                              Integer halfOpenSuccessThreshold,
                              Duration dispatchTimeout,
                              Duration healthCheckTimeout,
                              Integer healthWindow,
                              Integer eventLogCapacity,
                              Integer pipelineArchiveLimit,
                              Integer sharedContextLimit,
                              Pump pump) {
        this.enabled = enabled == null || enabled;
        this.failureThreshold = atLeastOne(failureThreshold,
            CircuitBreakerSettings.DEFAULT_FAILURE_THRESHOLD, "failure-threshold");
        this.recoveryTimeout = nonNegative(recoveryTimeout,
            CircuitBreakerSettings.DEFAULT_RECOVERY_TIMEOUT, "recovery-timeout");
        this.halfOpenSuccessThreshold = atLeastOne(halfOpenSuccessThreshold,
            CircuitBreakerSettings.DEFAULT_HALF_OPEN_SUCCESS_THRESHOLD, "half-open-success-threshold");
        this.dispatchTimeout = positive(dispatchTimeout, BusSettings.DEFAULT_DISPATCH_TIMEOUT, "dispatch-timeout");
        this.healthCheckTimeout = positive(healthCheckTimeout, HealthMonitor.DEFAULT_TIMEOUT, "health-check-timeout");
        this.healthWindow = atLeastOne(healthWindow, HealthTracker.DEFAULT_WINDOW, "health-window");
        this.eventLogCapacity = atLeastOne(eventLogCapacity, EventLog.DEFAULT_CAPACITY, "event-log-capacity");
        this.pipelineArchiveLimit = atLeastOne(pipelineArchiveLimit,
            PipelineTracker.DEFAULT_ARCHIVE_LIMIT, "pipeline-archive-limit");
        this.sharedContextLimit = atLeastOne(sharedContextLimit,
            SharedContext.DEFAULT_MAX_ENTRIES, "shared-context-limit");
        this.pump = pump == null ? new Pump(null, null) : pump;
    }

    public static AgentBusProperties defaults() {
        return new AgentBusProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public BusSettings toSettings() {
        return new BusSettings(
            new CircuitBreakerSettings(failureThreshold, recoveryTimeout, halfOpenSuccessThreshold),
            dispatchTimeout,
            healthCheckTimeout,
            healthWindow,
            eventLogCapacity,
            pipelineArchiveLimit,
            sharedContextLimit);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public int getHalfOpenSuccessThreshold() {
        return halfOpenSuccessThreshold;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public int getHealthWindow() {
        return healthWindow;
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    public int getPipelineArchiveLimit() {
        return pipelineArchiveLimit;
    }

    public int getSharedContextLimit() {
        return sharedContextLimit;
    }

    public Pump getPump() {
        return pump;
    }

    /**
     * Background draining of messages queued with {@code enqueue}.
     */
    public static final class Pump {

        private final boolean enabled;
        private final Duration idleInterval;

        public Pump(Boolean enabled, Duration idleInterval) {
            this.enabled = enabled != null && enabled;
            this.idleInterval = positive(idleInterval, BacklogPump.DEFAULT_IDLE_INTERVAL, "pump.idle-interval");
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Duration getIdleInterval() {
            return idleInterval;
        }
    }

    private static int atLeastOne(Integer value, int defaultValue, String property) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 1) {
            throw new IllegalArgumentException(PREFIX + property + " must be >= 1");
        }
        return value;
    }

    private static Duration nonNegative(Duration value, Duration defaultValue, String property) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(PREFIX + property + " must not be negative");
        }
        return value;
    }

    private static Duration positive(Duration value, Duration defaultValue, String property) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(PREFIX + property + " must be positive");
        }
        return value;
    }
}
