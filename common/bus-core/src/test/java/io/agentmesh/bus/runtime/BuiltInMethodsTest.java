package io.agentmesh.bus.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.agentmesh.bus.breaker.CircuitBreakerSettings;
import io.agentmesh.bus.breaker.CircuitState;
import io.agentmesh.bus.model.Message;
import io.agentmesh.bus.model.MessageKind;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BuiltInMethodsTest {

  private final AgentBusController bus = new AgentBusController();

  @AfterEach
  void tearDown() {
    bus.close();
  }

  @Test
  void getAgentsListsRegistrations() {
    bus.register(new RecordingAgent("risk-1", "risk"));

    Message response = call("g-1", "get_agents", Map.of());

    assertThat(response.id()).isEqualTo("agents_g-1");
    assertThat(response.method()).isEqualTo("agents_list");
    assertThat(listParam(response, "agents"))
        .singleElement()
        .satisfies(agent -> assertThat(agent).containsEntry("agentId", "risk-1").containsEntry("role", "risk"));
  }

  @Test
  void contextRoundTripsThroughBuiltIns() {
    Message set = call("s-1", "set_context", Map.of("key", "regime", "value", "trend"));
    Message get = call("c-1", "get_context", Map.of("key", "regime"));
    Message all = call("c-2", "get_context", Map.of());

    assertThat(set.id()).isEqualTo("context_set_s-1");
    assertThat(set.method()).isEqualTo("context_updated");
    assertThat(set.params()).containsEntry("success", true);
    assertThat(get.id()).isEqualTo("context_c-1");
    assertThat(get.params()).containsEntry("key", "regime").containsEntry("value", "trend");
    assertThat(mapParam(all, "value")).containsEntry("regime", "trend");
    assertThat(bus.contextValue("regime")).contains("trend");
  }

  @Test
  void broadcastBuiltInReportsResponses() {
    bus.register(new RecordingAgent("a-1", "alpha"));
    bus.register(new RecordingAgent("b-1", "beta"));

    Message response = call("b-1", "broadcast", Map.of("method", "session_open", "params", Map.of("session", "LDN")));

    assertThat(response.id()).isEqualTo("broadcast_result_b-1");
    assertThat(response.method()).isEqualTo("broadcast_complete");
    assertThat(response.params()).containsEntry("agent_count", 2);
    assertThat(listParam(response, "responses")).allSatisfy(encoded ->
        assertThat(encoded).containsEntry("method", "handled").containsEntry("kind", "response"));
  }

  @Test
  void pipelineBuiltInsStartAndReport() {
    Message started = call("p-1", "start_pipeline", Map.of("pipeline_id", "daily", "config", Map.of("stages", 3)));
    Message status = call("p-2", "pipeline_status", Map.of("pipeline_id", "daily"));
    Message duplicate = call("p-3", "start_pipeline", Map.of("pipeline_id", "daily"));

    assertThat(started.id()).isEqualTo("pipeline_started_p-1");
    assertThat(started.params()).containsEntry("pipeline_id", "daily").containsEntry("status", "started");
    assertThat(status.id()).isEqualTo("pipeline_status_p-2");
    assertThat(status.method()).isEqualTo("pipeline_status_response");
    assertThat(mapParam(status, "pipeline")).containsEntry("status", "RUNNING");
    assertThat(status.params().get("all_pipelines")).isEqualTo(List.of("daily"));
    assertThat(duplicate.kind()).isEqualTo(MessageKind.ERROR);
    assertThat(duplicate.id()).isEqualTo("pipeline_error_p-3");
    assertThat(duplicate.params()).containsEntry("pipeline_id", "daily");
  }

  @Test
  void resetCircuitBreakerClosesKnownAgentBreaker() {
    bus.register(new RecordingAgent("flaky-1", "flaky").failing(true),
        new CircuitBreakerSettings(1, Duration.ofSeconds(30), 3));
    bus.route(Message.builder("f-1", "work").recipient("flaky-1").build());
    assertThat(bus.breaker("flaky-1").orElseThrow().state()).isEqualTo(CircuitState.OPEN);

    Message reset = call("r-1", "reset_circuit_breaker", Map.of("agent_id", "flaky-1"));

    assertThat(reset.id()).isEqualTo("breaker_reset_r-1");
    assertThat(reset.method()).isEqualTo("circuit_breaker_reset");
    assertThat(bus.breaker("flaky-1").orElseThrow().state()).isEqualTo(CircuitState.CLOSED);
    assertThat(bus.queryEvents(5, "circuit_reset")).hasSize(1);
  }

  @Test
  void resetCircuitBreakerForUnknownAgentIsAnError() {
    Message response = call("r-2", "reset_circuit_breaker", Map.of("agent_id", "ghost"));

    assertThat(response.kind()).isEqualTo(MessageKind.ERROR);
    assertThat(response.id()).isEqualTo("breaker_error_r-2");
    assertThat(response.params()).containsEntry("error", "Agent ghost not found or no circuit breaker");
  }

  @Test
  void eventHistoryHonoursLimitAndFilter() {
    bus.register(new RecordingAgent("a-1", "alpha"));
    bus.register(new RecordingAgent("b-1", "beta"));

    Message response = call("e-1", "get_event_history", Map.of("limit", 1, "event_type", "agent_registered"));

    assertThat(response.id()).isEqualTo("events_e-1");
    assertThat(response.method()).isEqualTo("event_history");
    assertThat(response.params()).containsEntry("filtered_count", 1);
    assertThat(listParam(response, "events"))
        .singleElement()
        .satisfies(event -> assertThat(event).containsEntry("type", "agent_registered"));
  }

  @Test
  void malformedParametersComeBackAsErrors() {
    Message response = call("e-2", "get_event_history", Map.of("limit", "lots"));

    assertThat(response.kind()).isEqualTo(MessageKind.ERROR);
    assertThat(response.id()).isEqualTo("error_e-2");
    assertThat(response.params()).containsEntry("error_type", "invalid_request");
  }

  @Test
  void metricsAndHealthBuiltIns() {
    bus.register(new RecordingAgent("a-1", "alpha"));

    Message health = call("h-1", "health_check", Map.of());
    Message metrics = call("m-1", "get_metrics", Map.of());

    assertThat(health.id()).isEqualTo("health_h-1");
    assertThat(health.method()).isEqualTo("health_status");
    assertThat(mapParam(health, "agents")).containsKey("a-1");
    assertThat(metrics.id()).isEqualTo("metrics_m-1");
    assertThat(mapParam(metrics, "controller_metrics"))
        .containsEntry("registeredAgents", 1)
        .containsKey("totalMessages");
  }

  @Test
  void emergencyShutdownBuiltInHaltsController() {
    bus.register(new RecordingAgent("a-1", "alpha"));

    Message response = call("x-1", "emergency_shutdown", Map.of("reason", "manual"));

    assertThat(response.id()).isEqualTo("shutdown_x-1");
    assertThat(response.method()).isEqualTo("emergency_shutdown_complete");
    assertThat(response.params()).containsEntry("reason", "manual");
    assertThat(bus.isRunning()).isFalse();
    assertThat(bus.agent("a-1").orElseThrow().active()).isFalse();
  }

  private Message call(String id, String method, Map<String, Object> params) {
    Message response = bus.route(Message.builder(id, method).params(params).sender("operator").build());
    assertThat(response.recipient()).isEqualTo("operator");
    return response;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mapParam(Message message, String key) {
    return (Map<String, Object>) message.params().get(key);
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> listParam(Message message, String key) {
    return (List<Map<String, Object>>) message.params().get(key);
  }
}
