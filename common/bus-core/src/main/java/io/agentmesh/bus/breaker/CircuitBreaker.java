package io.agentmesh.bus.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failure-isolation state machine guarding dispatch to a single agent.
 * <p>
 * A closed breaker counts failures and decays the count by one on each success. Reaching
 * {@link CircuitBreakerSettings#failureThreshold()} opens it. The open to half-open move is
 * evaluated lazily in {@link #tryAcquire()} once the recovery timeout has elapsed since the last
 * failure. While half-open only one probe may be in flight; consecutive probe successes close the
 * breaker and any failure reopens it.
 * <p>
 * Each admitted dispatch holds a {@link Permit}. Only the permit of the current half-open probe
 * counts towards closing the breaker, so a slow dispatch admitted while closed cannot pass for a
 * probe when it completes after the breaker has tripped and recovered.
 */
public final class CircuitBreaker {

  @FunctionalInterface
  public interface TransitionListener {
    void onTransition(CircuitState from, CircuitState to, CircuitBreakerSnapshot snapshot);

    TransitionListener NO_OP = (from, to, snapshot) -> { };
  }

  /**
   * Admission token returned by {@link #tryAcquire()} and handed back with the dispatch outcome.
   */
  public static final class Permit {

    private final boolean probe;
    private final long generation;

    private Permit(boolean probe, long generation) {
      this.probe = probe;
      this.generation = generation;
    }

    public boolean isProbe() {
      return probe;
    }
  }

  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String agentId;
  private final CircuitBreakerSettings settings;
  private final Clock clock;
  private final TransitionListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private Instant lastFailureTime;
  private int halfOpenSuccesses;
  private boolean probeInFlight;
  private long probeGeneration;

  public CircuitBreaker(String agentId, CircuitBreakerSettings settings, Clock clock, TransitionListener listener) {
    this.agentId = Objects.requireNonNull(agentId, "agentId");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener == null ? TransitionListener.NO_OP : listener;
  }

  /**
   * Returns a permit when a dispatch may proceed. An empty result means the caller must fail fast
   * without invoking the agent.
   */
  public synchronized Optional<Permit> tryAcquire() {
    switch (state) {
      case CLOSED:
        return Optional.of(new Permit(false, probeGeneration));
      case OPEN:
        if (!recoveryElapsed()) {
          return Optional.empty();
        }
        halfOpenSuccesses = 0;
        transition(CircuitState.HALF_OPEN);
        log.info("Circuit breaker for {} moved to HALF_OPEN", agentId);
        return Optional.of(issueProbe());
      case HALF_OPEN:
        if (probeInFlight) {
          return Optional.empty();
        }
        return Optional.of(issueProbe());
      default:
        throw new IllegalStateException("Unhandled breaker state " + state);
    }
  }

  public synchronized void recordSuccess(Permit permit) {
    Objects.requireNonNull(permit, "permit");
    switch (state) {
      case HALF_OPEN:
        if (!isCurrentProbe(permit)) {
          // admitted before the breaker tripped; says nothing about recovery
          return;
        }
        probeInFlight = false;
        halfOpenSuccesses++;
        if (halfOpenSuccesses >= settings.halfOpenSuccessThreshold()) {
          failureCount = 0;
          halfOpenSuccesses = 0;
          transition(CircuitState.CLOSED);
          log.info("Circuit breaker for {} CLOSED", agentId);
        }
        break;
      case CLOSED:
        failureCount = Math.max(0, failureCount - 1);
        break;
      default:
        // the open window stands
        break;
    }
  }

  public synchronized void recordFailure(Permit permit) {
    Objects.requireNonNull(permit, "permit");
    recordFailure();
  }

  /**
   * Records a failure that was not preceded by an admitted dispatch, such as a message addressed to
   * an inactive agent.
   */
  public synchronized void recordFailure() {
    failureCount++;
    lastFailureTime = clock.instant();
    if (state == CircuitState.HALF_OPEN) {
      probeInFlight = false;
      halfOpenSuccesses = 0;
      trip();
    } else if (state == CircuitState.CLOSED && failureCount >= settings.failureThreshold()) {
      trip();
    }
  }

  /**
   * Returns the breaker to a fresh closed state. Unlike organic transitions this does not notify
   * the listener; callers record the reset themselves.
   */
  public synchronized void reset() {
    state = CircuitState.CLOSED;
    failureCount = 0;
    lastFailureTime = null;
    halfOpenSuccesses = 0;
    probeInFlight = false;
    log.info("Circuit breaker reset for {}", agentId);
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized CircuitBreakerSnapshot snapshot() {
    return snapshotUnlocked();
  }

  public CircuitBreakerSettings settings() {
    return settings;
  }

  public String agentId() {
    return agentId;
  }

  private Permit issueProbe() {
    probeInFlight = true;
    probeGeneration++;
    return new Permit(true, probeGeneration);
  }

  private boolean isCurrentProbe(Permit permit) {
    return permit.probe && permit.generation == probeGeneration && probeInFlight;
  }

  private void trip() {
    transition(CircuitState.OPEN);
    log.warn("Circuit breaker OPENED for {} after {} failures", agentId, failureCount);
  }

  private boolean recoveryElapsed() {
    if (lastFailureTime == null) {
      return true;
    }
    Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
    return sinceFailure.compareTo(settings.recoveryTimeout()) > 0;
  }

  private void transition(CircuitState next) {
    CircuitState previous = state;
    state = next;
    if (previous != next) {
      listener.onTransition(previous, next, snapshotUnlocked());
    }
  }

  private CircuitBreakerSnapshot snapshotUnlocked() {
    return new CircuitBreakerSnapshot(
        agentId,
        state,
        failureCount,
        settings.failureThreshold(),
        settings.recoveryTimeout(),
        lastFailureTime,
        halfOpenSuccesses);
  }
}
