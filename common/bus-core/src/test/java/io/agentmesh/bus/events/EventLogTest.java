package io.agentmesh.bus.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentmesh.bus.support.MutableClock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventLogTest {

  private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

  @Test
  void evictsOldestOnceCapacityIsExceeded() {
    EventLog log = new EventLog(3, clock);

    log.append("first", Map.of());
    log.append("second", Map.of());
    log.append("third", Map.of());
    log.append("fourth", Map.of());

    assertThat(log.size()).isEqualTo(3);
    assertThat(log.totalAppended()).isEqualTo(4);
    assertThat(log.query(10, null))
        .extracting(BusEvent::type)
        .containsExactly("second", "third", "fourth");
  }

  @Test
  void queryReturnsMostRecentMatchesNewestLast() {
    EventLog log = new EventLog(10, clock);
    log.append("a", Map.of("n", 1));
    log.append("b", Map.of("n", 2));
    log.append("a", Map.of("n", 3));
    log.append("b", Map.of("n", 4));
    log.append("a", Map.of("n", 5));

    List<BusEvent> matches = log.query(2, "a");

    assertThat(matches).extracting(event -> event.data().get("n")).containsExactly(3, 5);
    assertThat(matches).extracting(BusEvent::id).containsExactly("evt_3", "evt_5");
    assertThat(log.query(3, null)).extracting(BusEvent::type).containsExactly("a", "b", "a");
  }

  @Test
  void stampsEventsWithClock() {
    EventLog log = new EventLog(2, clock);

    BusEvent event = log.append("tick", null);

    assertThat(event.timestamp()).isEqualTo(clock.instant());
    assertThat(event.data()).isEmpty();
  }

  @Test
  void rejectsInvalidArguments() {
    EventLog log = new EventLog(1, clock);

    assertThat(log.query(0, null)).isEmpty();
    assertThatThrownBy(() -> log.query(-1, null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EventLog(0, clock)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> log.append(" ", Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("type must not be null or blank");
  }
}
