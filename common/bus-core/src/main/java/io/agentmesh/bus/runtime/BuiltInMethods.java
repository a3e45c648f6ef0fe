package io.agentmesh.bus.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmesh.bus.error.AgentBusException;
import io.agentmesh.bus.events.BusEvent;
import io.agentmesh.bus.model.Message;
import io.agentmesh.bus.model.MessageCodec;
import io.agentmesh.bus.model.MessageKind;
import io.agentmesh.bus.pipeline.PipelineSnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative methods answered by the controller itself. They bypass agent lookup and circuit
 * breakers, and every response is addressed to the request's sender.
 */
final class BuiltInMethods {

  private static final Logger log = LoggerFactory.getLogger(BuiltInMethods.class);

  static final int DEFAULT_EVENT_HISTORY_LIMIT = 100;

  @FunctionalInterface
  interface Handler {
    Message handle(Message message);
  }

  private final AgentBusController bus;
  private final MessageCodec codec;
  private final ObjectMapper mapper;
  private final Clock clock;
  private final Map<String, Handler> handlers = new LinkedHashMap<>();

  BuiltInMethods(AgentBusController bus, MessageCodec codec, ObjectMapper mapper, Clock clock) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    handlers.put("ping", this::ping);
    handlers.put("get_agents", this::getAgents);
    handlers.put("get_metrics", this::getMetrics);
    handlers.put("get_context", this::getContext);
    handlers.put("set_context", this::setContext);
    handlers.put("broadcast", this::broadcast);
    handlers.put("health_check", this::healthCheck);
    handlers.put("start_pipeline", this::startPipeline);
    handlers.put("pipeline_status", this::pipelineStatus);
    handlers.put("reset_circuit_breaker", this::resetCircuitBreaker);
    handlers.put("get_event_history", this::eventHistory);
    handlers.put("emergency_shutdown", this::emergencyShutdown);
  }

  Optional<Handler> find(String method) {
    Handler handler = handlers.get(method);
    return handler == null ? Optional.empty() : Optional.of(guarded(handler));
  }

  private Handler guarded(Handler handler) {
    return message -> {
      try {
        return handler.handle(message);
      } catch (AgentBusException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        log.warn("Built-in {} rejected message {}: {}", message.method(), message.id(), ex.getMessage());
        return message.reply("error", "error",
            AgentBusController.fields("error", ex.getMessage(), "error_type", "invalid_request"),
            MessageKind.ERROR);
      }
    };
  }

  private Message ping(Message message) {
    return message.reply("pong", "pong", AgentBusController.fields("timestamp", now()));
  }

  private Message getAgents(Message message) {
    return message.reply("agents", "agents_list", AgentBusController.fields("agents", render(bus.agents())));
  }

  private Message getMetrics(Message message) {
    return message.reply("metrics", "metrics", AgentBusController.fields("controller_metrics", render(bus.metrics())));
  }

  private Message getContext(Message message) {
    String key = message.param("key");
    Object value = key == null ? bus.contextSnapshot() : bus.contextValue(key).orElse(null);
    return message.reply("context", "context_value", AgentBusController.fields("key", key, "value", value));
  }

  private Message setContext(Message message) {
    String key = message.param("key");
    if (key != null && !key.isBlank()) {
      bus.putContext(key, message.params().get("value"));
    }
    return message.reply("context_set", "context_updated",
        AgentBusController.fields("key", key, "success", key != null && !key.isBlank()));
  }

  private Message broadcast(Message message) {
    String method = Optional.ofNullable(message.param("method")).orElse("notification");
    List<Message> responses = bus.broadcast(method, mapParam(message, "params"));
    List<Map<String, Object>> encoded = new ArrayList<>(responses.size());
    for (Message response : responses) {
      encoded.add(codec.encodeToMap(response));
    }
    return message.reply("broadcast_result", "broadcast_complete",
        AgentBusController.fields("responses", encoded, "agent_count", encoded.size()));
  }

  private Message healthCheck(Message message) {
    return message.reply("health", "health_status", AgentBusController.fields("agents", render(bus.healthCheck())));
  }

  private Message startPipeline(Message message) {
    String requested = message.param("pipeline_id");
    try {
      String pipelineId = bus.startPipeline(requested, mapParam(message, "config"));
      return message.reply("pipeline_started", "pipeline_started", AgentBusController.fields(
          "pipeline_id", pipelineId,
          "status", "started",
          "timestamp", now()));
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.warn("Pipeline {} could not be started: {}", requested, ex.getMessage());
      return message.reply("pipeline_error", "pipeline_error",
          AgentBusController.fields("error", ex.getMessage(), "pipeline_id", requested),
          MessageKind.ERROR);
    }
  }

  private Message pipelineStatus(Message message) {
    String pipelineId = message.param("pipeline_id");
    Optional<PipelineSnapshot> pipeline = pipelineId == null ? Optional.empty() : bus.pipelineStatus(pipelineId);
    List<String> running = new ArrayList<>();
    for (PipelineSnapshot snapshot : bus.pipelineStatus()) {
      running.add(snapshot.id());
    }
    return message.reply("pipeline_status", "pipeline_status_response", AgentBusController.fields(
        "pipeline", pipeline.map(this::render).orElse(null),
        "all_pipelines", running));
  }

  private Message resetCircuitBreaker(Message message) {
    String agentId = message.param("agent_id");
    if (agentId == null || bus.breaker(agentId).isEmpty()) {
      return message.reply("breaker_error", "error",
          AgentBusController.fields("error", "Agent " + agentId + " not found or no circuit breaker"),
          MessageKind.ERROR);
    }
    bus.resetBreaker(agentId);
    return message.reply("breaker_reset", "circuit_breaker_reset", AgentBusController.fields(
        "agent_id", agentId,
        "status", "reset",
        "timestamp", now()));
  }

  private Message eventHistory(Message message) {
    int limit = intParam(message, "limit", DEFAULT_EVENT_HISTORY_LIMIT);
    List<BusEvent> history = bus.queryEvents(limit, message.param("event_type"));
    return message.reply("events", "event_history", AgentBusController.fields(
        "events", render(history),
        "total_events", bus.eventLogSize(),
        "filtered_count", history.size()));
  }

  private Message emergencyShutdown(Message message) {
    String reason = Optional.ofNullable(message.param("reason")).orElse("Emergency shutdown requested");
    int drained = bus.emergencyShutdown(reason);
    return message.reply("shutdown", "emergency_shutdown_complete", AgentBusController.fields(
        "reason", reason,
        "drained_messages", drained,
        "timestamp", now()));
  }

  private String now() {
    return clock.instant().toString();
  }

  private Object render(Object value) {
    return mapper.convertValue(value, Object.class);
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> mapParam(Message message, String key) {
    Object value = message.params().get(key);
    if (value == null) {
      return Map.of();
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException(key + " must be an object");
    }
    return mapper.convertValue(value, Map.class);
  }

  private static int intParam(Message message, String key, int defaultValue) {
    Object value = message.params().get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer", ex);
    }
  }
}
