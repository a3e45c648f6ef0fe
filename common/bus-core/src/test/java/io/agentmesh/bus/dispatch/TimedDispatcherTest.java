package io.agentmesh.bus.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.error.AgentHandlerException;
import io.agentmesh.bus.error.DispatchTimeoutException;
import io.agentmesh.bus.model.Message;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TimedDispatcherTest {

  private final TimedDispatcher dispatcher = new TimedDispatcher();

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  @Test
  void returnsHandlerResponse() {
    Agent agent = Agent.of("echo-1", "echo", message -> message.reply("echo", "echoed", Map.of()));

    Message response = dispatcher.dispatch(agent, Message.request("m-1", "echo", null), Duration.ofSeconds(1));

    assertThat(response.id()).isEqualTo("echo_m-1");
  }

  @Test
  void timesOutAndInterruptsSlowHandler() throws InterruptedException {
    CountDownLatch interrupted = new CountDownLatch(1);
    Agent slow = Agent.of("slow-1", "slow", message -> {
      try {
        Thread.sleep(5_000);
      } catch (InterruptedException ex) {
        interrupted.countDown();
      }
      return null;
    });

    assertThatThrownBy(() -> dispatcher.dispatch(slow, Message.request("m-2", "slow", null), Duration.ofMillis(50)))
        .isInstanceOfSatisfying(DispatchTimeoutException.class, ex -> {
          assertThat(ex.errorType()).isEqualTo("dispatch_timeout");
          assertThat(ex.getMessage()).isEqualTo("Agent slow-1 timed out after 50ms");
        });
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void wrapsHandlerExceptions() {
    Agent broken = Agent.of("broken-1", "broken", message -> {
      throw new IllegalStateException("boom");
    });

    assertThatThrownBy(() -> dispatcher.dispatch(broken, Message.request("m-3", "broken", null), Duration.ofSeconds(1)))
        .isInstanceOf(AgentHandlerException.class)
        .hasMessage("Agent broken-1 failed: boom")
        .hasCauseInstanceOf(IllegalStateException.class);
  }
}
