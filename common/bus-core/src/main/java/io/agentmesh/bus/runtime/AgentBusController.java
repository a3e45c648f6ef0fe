package io.agentmesh.bus.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.agent.AgentHandler;
import io.agentmesh.bus.agent.AgentRegistration;
import io.agentmesh.bus.agent.AgentRegistry;
import io.agentmesh.bus.agent.AgentSnapshot;
import io.agentmesh.bus.agent.AgentStats;
import io.agentmesh.bus.breaker.CircuitBreaker;
import io.agentmesh.bus.breaker.CircuitBreakerSettings;
import io.agentmesh.bus.breaker.CircuitBreakerSnapshot;
import io.agentmesh.bus.breaker.CircuitState;
import io.agentmesh.bus.context.SharedContext;
import io.agentmesh.bus.dispatch.Priority;
import io.agentmesh.bus.dispatch.PriorityLanes;
import io.agentmesh.bus.dispatch.QueuedMessage;
import io.agentmesh.bus.dispatch.TimedDispatcher;
import io.agentmesh.bus.error.AgentBusException;
import io.agentmesh.bus.error.CircuitOpenException;
import io.agentmesh.bus.error.InactiveAgentException;
import io.agentmesh.bus.error.UnroutableMessageException;
import io.agentmesh.bus.events.BusEvent;
import io.agentmesh.bus.events.BusEventTypes;
import io.agentmesh.bus.events.EventLog;
import io.agentmesh.bus.health.HealthMonitor;
import io.agentmesh.bus.health.HealthRecord;
import io.agentmesh.bus.health.HealthTracker;
import io.agentmesh.bus.model.Message;
import io.agentmesh.bus.model.MessageCodec;
import io.agentmesh.bus.model.MessageKind;
import io.agentmesh.bus.pipeline.PipelineSnapshot;
import io.agentmesh.bus.pipeline.PipelineTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the agent bus.
 * <p>
 * Every routed message goes through the priority lanes, then to a built-in handler, a directly
 * addressed agent, or every active agent whose role equals the message method. Agent dispatch is
 * guarded by a per-agent circuit breaker and bounded by a timeout. Operational failures are
 * converted into error-kind messages, so {@link #route(Message, Priority)} only throws for
 * programmer errors.
 * <p>
 * Each collaborator guards its own state. No lock is held while an agent runs, which lets agent
 * handlers route further messages through the bus.
 */
public final class AgentBusController implements AgentBus, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AgentBusController.class);

  private static final String MDC_MESSAGE_ID = "message_id";
  private static final String MDC_AGENT_ID = "agent_id";

  private final BusSettings settings;
  private final Clock clock;
  private final ObjectMapper mapper;
  private final MessageCodec codec;
  private final AgentRegistry registry = new AgentRegistry();
  private final PriorityLanes lanes = new PriorityLanes();
  private final EventLog events;
  private final PipelineTracker pipelines;
  private final SharedContext context;
  private final TimedDispatcher dispatcher = new TimedDispatcher();
  private final HealthMonitor healthMonitor;
  private final BusMeters meters;
  private final BuiltInMethods builtIns;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong totalMessages = new AtomicLong();
  private final AtomicLong successfulRoutes = new AtomicLong();
  private final AtomicLong failedRoutes = new AtomicLong();
  private final AtomicLong totalLatencyNanos = new AtomicLong();
  private final AtomicLong breakerTrips = new AtomicLong();
  private final AtomicLong broadcastSequence = new AtomicLong();

  public AgentBusController() {
    this(BusSettings.defaults());
  }

  public AgentBusController(BusSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public AgentBusController(BusSettings settings, Clock clock) {
    this(settings, clock, new SimpleMeterRegistry(), new ObjectMapper());
  }

  public AgentBusController(BusSettings settings, Clock clock, MeterRegistry meterRegistry, ObjectMapper objectMapper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.codec = new MessageCodec(mapper);
    this.events = new EventLog(settings.eventLogCapacity(), clock);
    this.pipelines = new PipelineTracker(settings.pipelineArchiveLimit(), clock, events);
    this.context = new SharedContext(settings.sharedContextLimit());
    this.healthMonitor = new HealthMonitor(clock, settings.healthCheckTimeout(), this::dispatchToAgent);
    this.meters = new BusMeters(Objects.requireNonNull(meterRegistry, "meterRegistry"), lanes);
    this.builtIns = new BuiltInMethods(this, codec, mapper, clock);
  }

  // registration

  public void register(String agentId, String role, AgentHandler handler) {
    register(Agent.of(agentId, role, handler));
  }

  public void register(Agent agent) {
    register(agent, settings.breaker());
  }

  /**
   * Registers the agent with its own breaker tuning. Re-registering an id replaces the previous
   * agent and resets its breaker, health and statistics.
   */
  public void register(Agent agent, CircuitBreakerSettings breakerSettings) {
    Objects.requireNonNull(agent, "agent");
    Objects.requireNonNull(breakerSettings, "breakerSettings");
    String agentId = requireText(agent.id(), "agentId");
    String role = requireText(agent.role(), "role");
    CircuitBreaker breaker = new CircuitBreaker(agentId, breakerSettings, clock,
        (from, to, snapshot) -> onBreakerTransition(from, to, snapshot));
    AgentRegistration registration = new AgentRegistration(
        agent, breaker, new HealthTracker(settings.healthWindow()), clock.instant());
    registry.register(registration).ifPresent(previous -> {
      if (previous.agent() != agent) {
        previous.agent().onUnregister();
      }
    });
    events.append(BusEventTypes.AGENT_REGISTERED, fields("agent_id", agentId, "role", role));
    log.info("Registered agent {} with role {}", agentId, role);
    agent.onRegister(this);
  }

  public boolean unregister(String agentId) {
    Optional<AgentRegistration> removed = registry.unregister(agentId);
    removed.ifPresent(registration -> {
      events.append(BusEventTypes.AGENT_UNREGISTERED, fields("agent_id", agentId));
      log.info("Unregistered agent {}", agentId);
      registration.agent().onUnregister();
    });
    return removed.isPresent();
  }

  public void setAgentActive(String agentId, boolean active) {
    requireAgent(agentId).setActive(active);
    log.info("Agent {} marked {}", agentId, active ? "active" : "inactive");
  }

  public Optional<AgentSnapshot> agent(String agentId) {
    return registry.find(agentId).map(AgentRegistration::snapshot);
  }

  public List<AgentSnapshot> agents() {
    List<AgentSnapshot> snapshots = new ArrayList<>();
    for (AgentRegistration registration : registry.all()) {
      snapshots.add(registration.snapshot());
    }
    return List.copyOf(snapshots);
  }

  // routing

  @Override
  public Message route(Message message, Priority priority) {
    requireArgument(message, "message");
    requireArgument(priority, "priority");
    ensureOpen();
    QueuedMessage next = lanes.offerAndPoll(new QueuedMessage(message, priority, clock.instant()));
    return process(next);
  }

  public Message route(Message message, String priority) {
    return route(message, Priority.fromName(priority));
  }

  @Override
  public void enqueue(Message message, Priority priority) {
    requireArgument(message, "message");
    requireArgument(priority, "priority");
    ensureOpen();
    lanes.offer(new QueuedMessage(message, priority, clock.instant()));
    log.debug("Queued message {} on {} lane", message.id(), priority);
  }

  /**
   * Processes the head of the highest non-empty lane, if any.
   */
  public Optional<Message> drainOne() {
    ensureOpen();
    return lanes.poll().map(this::process);
  }

  @Override
  public List<Message> broadcast(String method, Map<String, Object> params) {
    requireText(method, "method");
    Message notification = Message.builder("broadcast_" + broadcastSequence.incrementAndGet(), method)
        .params(params)
        .kind(MessageKind.NOTIFICATION)
        .timestamp(clock.instant())
        .build();
    List<Message> responses = new ArrayList<>();
    for (AgentRegistration registration : registry.all()) {
      if (!registration.isActive()) {
        continue;
      }
      Message addressed = notification.withRecipient(registration.agentId());
      try {
        Message response = dispatchToAgent(registration, addressed, settings.dispatchTimeout());
        if (response != null) {
          responses.add(response);
        }
      } catch (CircuitOpenException ex) {
        recordSkipped(addressed, registration);
      } catch (AgentBusException ex) {
        log.warn("Broadcast {} to {} failed: {}", notification.id(), registration.agentId(), ex.getMessage());
      }
    }
    return List.copyOf(responses);
  }

  private Message process(QueuedMessage queued) {
    Message message = queued.message();
    long started = System.nanoTime();
    totalMessages.incrementAndGet();
    MDC.put(MDC_MESSAGE_ID, message.id());
    boolean success = false;
    try {
      events.append(BusEventTypes.MESSAGE_RECEIVED, fields(
          "message_id", message.id(),
          "method", message.method(),
          "priority", queued.priority().name(),
          "sender", message.sender(),
          "recipient", message.recipient()));
      Message response = dispatch(message);
      success = response.kind() != MessageKind.ERROR;
      return response;
    } catch (AgentBusException ex) {
      events.append(BusEventTypes.MESSAGE_FAILED, fields(
          "message_id", message.id(),
          "error", ex.getMessage(),
          "error_type", ex.errorType()));
      log.error("Routing of message {} ({}) failed: {}", message.id(), message.method(), ex.getMessage());
      return errorMessage(message, ex);
    } finally {
      long elapsed = System.nanoTime() - started;
      totalLatencyNanos.addAndGet(elapsed);
      if (success) {
        successfulRoutes.incrementAndGet();
      } else {
        failedRoutes.incrementAndGet();
      }
      meters.recordRoute(success, elapsed);
      MDC.remove(MDC_MESSAGE_ID);
    }
  }

  private Message dispatch(Message message) {
    Optional<BuiltInMethods.Handler> builtIn = builtIns.find(message.method());
    if (builtIn.isPresent()) {
      Message response = builtIn.get().handle(message);
      events.append(BusEventTypes.MESSAGE_ROUTED, fields(
          "message_id", message.id(), "route", "builtin", "method", message.method()));
      return response;
    }
    Optional<AgentRegistration> direct = registry.find(message.recipient());
    if (direct.isPresent()) {
      AgentRegistration registration = direct.get();
      Message response = dispatchToAgent(registration, message, settings.dispatchTimeout());
      events.append(BusEventTypes.MESSAGE_ROUTED, fields(
          "message_id", message.id(), "route", "direct", "agent_id", registration.agentId()));
      return response != null ? response : acknowledge(message, 1);
    }
    List<AgentRegistration> byRole = registry.findByRole(message.method());
    if (byRole.isEmpty()) {
      throw new UnroutableMessageException("No route for message " + message.id()
          + " (method " + message.method() + ", recipient " + message.recipient() + ")");
    }
    return dispatchToRole(message, byRole);
  }

  private Message dispatchToRole(Message message, List<AgentRegistration> candidates) {
    Message first = null;
    int delivered = 0;
    AgentBusException lastFailure = null;
    for (AgentRegistration registration : candidates) {
      try {
        Message response = dispatchToAgent(registration, message, settings.dispatchTimeout());
        delivered++;
        if (first == null && response != null) {
          first = response;
        }
      } catch (CircuitOpenException ex) {
        recordSkipped(message, registration);
        lastFailure = ex;
      } catch (AgentBusException ex) {
        lastFailure = ex;
      }
    }
    if (delivered == 0) {
      throw lastFailure;
    }
    events.append(BusEventTypes.MESSAGE_ROUTED, fields(
        "message_id", message.id(), "route", "role", "role", message.method(), "delivered", delivered));
    return first != null ? first : acknowledge(message, delivered);
  }

  /**
   * Runs one agent under its breaker and the given timeout. Used by routing and by health probes.
   */
  private Message dispatchToAgent(AgentRegistration registration, Message message, Duration timeout) {
    String agentId = registration.agentId();
    MDC.put(MDC_AGENT_ID, agentId);
    try {
      if (!registration.isActive()) {
        InactiveAgentException inactive = new InactiveAgentException(agentId);
        registration.breaker().recordFailure();
        registration.stats().recordError();
        recordFailure(message, registration, inactive);
        throw inactive;
      }
      CircuitBreaker.Permit permit = registration.breaker().tryAcquire()
          .orElseThrow(() -> new CircuitOpenException(agentId));
      registration.stats().recordReceived();
      long started = System.nanoTime();
      try {
        Message response = dispatcher.dispatch(registration.agent(), message, timeout);
        long elapsed = System.nanoTime() - started;
        registration.breaker().recordSuccess(permit);
        registration.stats().recordResponse(elapsed, response != null);
        meters.recordDispatch(agentId, true, elapsed);
        events.append(BusEventTypes.MESSAGE_HANDLED, fields(
            "message_id", message.id(),
            "agent_id", agentId,
            "duration_ms", Duration.ofNanos(elapsed).toMillis(),
            "responded", response != null));
        log.debug("Agent {} handled message {} in {}ms", agentId, message.id(), Duration.ofNanos(elapsed).toMillis());
        return response;
      } catch (AgentBusException ex) {
        registration.breaker().recordFailure(permit);
        registration.stats().recordError();
        meters.recordDispatch(agentId, false, System.nanoTime() - started);
        recordFailure(message, registration, ex);
        throw ex;
      }
    } finally {
      MDC.remove(MDC_AGENT_ID);
    }
  }

  private void recordFailure(Message message, AgentRegistration registration, AgentBusException ex) {
    events.append(BusEventTypes.MESSAGE_FAILED, fields(
        "message_id", message.id(),
        "agent_id", registration.agentId(),
        "error", ex.getMessage(),
        "error_type", ex.errorType()));
    log.warn("Agent {} failed message {}: {}", registration.agentId(), message.id(), ex.getMessage());
  }

  private void recordSkipped(Message message, AgentRegistration registration) {
    events.append(BusEventTypes.MESSAGE_SKIPPED, fields(
        "message_id", message.id(),
        "agent_id", registration.agentId(),
        "reason", "circuit_open"));
    log.debug("Skipped agent {} for message {}: circuit open", registration.agentId(), message.id());
  }

  private void onBreakerTransition(CircuitState from, CircuitState to, CircuitBreakerSnapshot snapshot) {
    Map<String, Object> data = fields(
        "agent_id", snapshot.agentId(),
        "previous_state", from.name(),
        "failure_count", snapshot.failureCount());
    switch (to) {
      case OPEN:
        breakerTrips.incrementAndGet();
        meters.recordTrip(snapshot.agentId());
        events.append(BusEventTypes.CIRCUIT_OPENED, data);
        break;
      case HALF_OPEN:
        events.append(BusEventTypes.CIRCUIT_HALF_OPEN, data);
        break;
      case CLOSED:
        events.append(BusEventTypes.CIRCUIT_CLOSED, data);
        break;
      default:
        break;
    }
  }

  Message acknowledge(Message message, int delivered) {
    return message.reply("ack", "ack", fields("delivered", delivered, "method", message.method()));
  }

  Message errorMessage(Message original, AgentBusException ex) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("error", ex.getMessage());
    params.put("error_type", ex.errorType());
    params.put("original_message", originalMessage(original));
    return original.reply("error", "error", params, MessageKind.ERROR);
  }

  /**
   * JSON map form of the request. Params Jackson cannot serialise are rendered with
   * {@code String.valueOf} so the error message can always be built.
   */
  private Map<String, Object> originalMessage(Message original) {
    try {
      return codec.encodeToMap(original);
    } catch (IllegalArgumentException ex) {
      log.warn("Params of message {} are not serialisable, rendering them as text: {}",
          original.id(), ex.getMessage());
      Map<String, Object> summary = fields(
          "id", original.id(),
          "method", original.method(),
          "params", String.valueOf(original.params()),
          "kind", original.kind().wireName(),
          "timestamp", original.timestamp().toString());
      if (original.sender() != null) {
        summary.put("sender", original.sender());
      }
      if (original.recipient() != null) {
        summary.put("recipient", original.recipient());
      }
      return summary;
    }
  }

  // pipelines

  public String startPipeline(String pipelineId, Map<String, Object> config) {
    return pipelines.start(pipelineId, config);
  }

  public PipelineSnapshot advanceStage(String pipelineId, int stageIndex, String stageName, Object result) {
    return pipelines.advanceStage(pipelineId, stageIndex, stageName, result);
  }

  public void recordPipelineError(String pipelineId, String error) {
    pipelines.recordError(pipelineId, error);
  }

  public PipelineSnapshot completePipeline(String pipelineId) {
    return pipelines.complete(pipelineId);
  }

  public PipelineSnapshot failPipeline(String pipelineId, String reason) {
    return pipelines.fail(pipelineId, reason);
  }

  public Optional<PipelineSnapshot> pipelineStatus(String pipelineId) {
    return pipelines.status(pipelineId);
  }

  /**
   * Running pipelines, oldest first.
   */
  public List<PipelineSnapshot> pipelineStatus() {
    return pipelines.activePipelines();
  }

  // administration

  public CircuitBreakerSnapshot resetBreaker(String agentId) {
    AgentRegistration registration = requireAgent(agentId);
    registration.breaker().reset();
    events.append(BusEventTypes.CIRCUIT_RESET, fields("agent_id", agentId));
    return registration.breaker().snapshot();
  }

  public Optional<CircuitBreakerSnapshot> breaker(String agentId) {
    return registry.find(agentId).map(registration -> registration.breaker().snapshot());
  }

  public List<BusEvent> queryEvents(int limit, String typeFilter) {
    return events.query(limit, typeFilter);
  }

  public long totalEvents() {
    return events.totalAppended();
  }

  public int eventLogSize() {
    return events.size();
  }

  /**
   * Pings every registered agent and returns the refreshed health records keyed by agent id.
   */
  public Map<String, HealthRecord> healthCheck() {
    List<AgentRegistration> targets = registry.all();
    events.append(BusEventTypes.HEALTH_CHECK, fields("agents", targets.size()));
    Map<String, HealthRecord> results = healthMonitor.pingAll(targets);
    log.info("Health check completed for {} agents", results.size());
    return results;
  }

  /**
   * Deactivates every agent, discards queued messages without processing them and halts the
   * controller. Returns the number of discarded messages.
   */
  public int emergencyShutdown(String reason) {
    String cause = reason == null || reason.isBlank() ? "Emergency shutdown requested" : reason;
    for (AgentRegistration registration : registry.all()) {
      registration.setActive(false);
    }
    int drained = lanes.drainAll().size();
    running.set(false);
    events.append(BusEventTypes.EMERGENCY_SHUTDOWN, fields("reason", cause, "drained_messages", drained));
    log.error("EMERGENCY SHUTDOWN: {} ({} queued messages discarded)", cause, drained);
    return drained;
  }

  public BusMetrics metrics() {
    Map<String, AgentStats.Snapshot> agentStats = new LinkedHashMap<>();
    Map<String, CircuitBreakerSnapshot> breakers = new LinkedHashMap<>();
    Map<String, HealthRecord> health = new LinkedHashMap<>();
    for (AgentRegistration registration : registry.all()) {
      agentStats.put(registration.agentId(), registration.stats().snapshot());
      breakers.put(registration.agentId(), registration.breaker().snapshot());
      health.put(registration.agentId(), registration.health().snapshot());
    }
    long total = totalMessages.get();
    double averageLatency = total == 0 ? 0.0 : totalLatencyNanos.get() / (double) total / 1_000_000.0;
    return new BusMetrics(
        total,
        successfulRoutes.get(),
        failedRoutes.get(),
        averageLatency,
        registry.size(),
        registry.activeCount(),
        breakerTrips.get(),
        lanes.sizes(),
        events.size(),
        agentStats,
        breakers,
        health,
        pipelines.counts(),
        context.size(),
        running.get());
  }

  // shared context

  @Override
  public Optional<Object> contextValue(String key) {
    return context.get(key);
  }

  @Override
  public void putContext(String key, Object value) {
    context.put(requireText(key, "key"), value);
  }

  public Map<String, Object> contextSnapshot() {
    return context.snapshot();
  }

  // lifecycle

  public boolean isRunning() {
    return running.get() && !closed.get();
  }

  public BusSettings settings() {
    return settings;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    running.set(false);
    dispatcher.close();
    log.info("Agent bus closed with {} registered agents", registry.size());
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Agent bus is closed");
    }
  }

  private AgentRegistration requireAgent(String agentId) {
    return registry.find(agentId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentId));
  }

  static Map<String, Object> fields(Object... keyValues) {
    Map<String, Object> data = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return data;
  }

  private static void requireArgument(Object value, String field) {
    if (value == null) {
      throw new IllegalArgumentException(field + " must not be null");
    }
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}
