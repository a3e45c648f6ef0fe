package io.agentmesh.bus.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.agentmesh.bus.dispatch.Priority;
import io.agentmesh.bus.model.Message;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BacklogPumpTest {

  private final AgentBusController bus = new AgentBusController();
  private final List<Message> responses = new CopyOnWriteArrayList<>();
  private final BacklogPump pump = new BacklogPump(bus, Duration.ofMillis(10), responses::add);

  @AfterEach
  void tearDown() {
    pump.close();
    bus.close();
  }

  @Test
  void drainsQueuedMessagesInPriorityOrder() {
    bus.register(new RecordingAgent("echo-1", "echo"));
    bus.enqueue(Message.request("low", "echo", null), Priority.LOW);
    bus.enqueue(Message.request("high", "echo", null), Priority.HIGH);

    pump.start();

    await().atMost(Duration.ofSeconds(5)).until(() -> responses.size() == 2);
    assertThat(responses).extracting(Message::id).containsExactly("handled_high", "handled_low");
  }

  @Test
  void keepsPollingUntilWorkArrives() {
    bus.register(new RecordingAgent("echo-1", "echo"));
    pump.start();

    bus.enqueue(Message.request("late", "echo", null), Priority.NORMAL);

    await().atMost(Duration.ofSeconds(5)).until(() -> responses.size() == 1);
    assertThat(pump.isRunning()).isTrue();
  }

  @Test
  void stopsOnceControllerHalts() {
    pump.start();

    bus.emergencyShutdown("test");

    await().atMost(Duration.ofSeconds(5)).until(() -> !pump.isRunning());
  }

  @Test
  void rejectsNonPositiveIdleInterval() {
    assertThatThrownBy(() -> new BacklogPump(bus, Duration.ZERO, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("idleInterval must be positive");
  }
}
