package io.agentmesh.bus.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentmesh.bus.model.Message;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PriorityLanesTest {

  private final PriorityLanes lanes = new PriorityLanes();

  @Test
  void drainsStrictlyByPriorityAndFifoWithinLane() {
    lanes.offer(queued("low-1", Priority.LOW));
    lanes.offer(queued("normal-1", Priority.NORMAL));
    lanes.offer(queued("critical-1", Priority.CRITICAL));
    lanes.offer(queued("high-1", Priority.HIGH));
    lanes.offer(queued("normal-2", Priority.NORMAL));
    lanes.offer(queued("critical-2", Priority.CRITICAL));

    assertThat(pollId()).isEqualTo("critical-1");
    assertThat(pollId()).isEqualTo("critical-2");
    assertThat(pollId()).isEqualTo("high-1");
    assertThat(pollId()).isEqualTo("normal-1");
    assertThat(pollId()).isEqualTo("normal-2");
    assertThat(pollId()).isEqualTo("low-1");
    assertThat(lanes.poll()).isEmpty();
  }

  @Test
  void offerAndPollHandsBackOutrankingBacklog() {
    lanes.offer(queued("high-1", Priority.HIGH));

    QueuedMessage taken = lanes.offerAndPoll(queued("normal-1", Priority.NORMAL));

    assertThat(taken.message().id()).isEqualTo("high-1");
    assertThat(lanes.size()).isEqualTo(1);
    assertThat(lanes.offerAndPoll(queued("low-1", Priority.LOW)).message().id()).isEqualTo("normal-1");
  }

  @Test
  void offerAndPollOnEmptyLanesReturnsTheSameMessage() {
    QueuedMessage taken = lanes.offerAndPoll(queued("only", Priority.LOW));

    assertThat(taken.message().id()).isEqualTo("only");
    assertThat(lanes.isEmpty()).isTrue();
  }

  @Test
  void drainAllDiscardsEverything() {
    lanes.offer(queued("a", Priority.LOW));
    lanes.offer(queued("b", Priority.CRITICAL));
    lanes.offer(queued("c", Priority.CRITICAL));

    Map<Priority, Integer> sizes = lanes.sizes();
    assertThat(sizes).containsEntry(Priority.CRITICAL, 2).containsEntry(Priority.LOW, 1)
        .containsEntry(Priority.HIGH, 0);

    assertThat(lanes.drainAll()).hasSize(3);
    assertThat(lanes.size()).isZero();
  }

  @Test
  void parsesPriorityNames() {
    assertThat(Priority.fromName("critical")).isEqualTo(Priority.CRITICAL);
    assertThat(Priority.fromName(" Low ")).isEqualTo(Priority.LOW);
    assertThatThrownBy(() -> Priority.fromName("urgent"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown priority: urgent");
  }

  private String pollId() {
    Optional<QueuedMessage> next = lanes.poll();
    assertThat(next).isPresent();
    return next.get().message().id();
  }

  private static QueuedMessage queued(String id, Priority priority) {
    return new QueuedMessage(Message.request(id, "work", null), priority, Instant.now());
  }
}
