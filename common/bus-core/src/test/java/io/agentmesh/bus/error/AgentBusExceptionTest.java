package io.agentmesh.bus.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AgentBusExceptionTest {

  @Test
  void agentScopedErrorsCarryAgentIdAndCode() {
    CircuitOpenException open = new CircuitOpenException("risk-1");
    InactiveAgentException inactive = new InactiveAgentException("risk-2");
    AgentHandlerException failed = new AgentHandlerException("risk-3", new IllegalStateException("stale book"));
    DispatchTimeoutException timedOut = new DispatchTimeoutException("risk-4", Duration.ofMillis(250));

    assertThat(open.agentId()).isEqualTo("risk-1");
    assertThat(open.errorType()).isEqualTo("circuit_open");
    assertThat(inactive.agentId()).isEqualTo("risk-2");
    assertThat(inactive.getMessage()).isEqualTo("Agent risk-2 is not active");
    assertThat(failed.agentId()).isEqualTo("risk-3");
    assertThat(failed.getMessage()).isEqualTo("Agent risk-3 failed: stale book");
    assertThat(failed.getCause()).isInstanceOf(IllegalStateException.class);
    assertThat(timedOut.agentId()).isEqualTo("risk-4");
    assertThat(timedOut.timeout()).isEqualTo(Duration.ofMillis(250));
    assertThat(timedOut.getMessage()).isEqualTo("Agent risk-4 timed out after 250ms");
  }

  @Test
  void handlerFailureWithoutMessageFallsBackToExceptionName() {
    AgentHandlerException failed = new AgentHandlerException("risk-1", new NullPointerException());

    assertThat(failed.getMessage()).isEqualTo("Agent risk-1 failed: NullPointerException");
    assertThat(new UnroutableMessageException("no route").errorType()).isEqualTo("unroutable");
  }
}
