package io.agentmesh.bus.dispatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Four FIFO lanes drained in strict priority order. Under sustained {@link Priority#CRITICAL} or
 * {@link Priority#HIGH} load lower lanes can starve.
 */
public final class PriorityLanes {

  private final EnumMap<Priority, ArrayDeque<QueuedMessage>> lanes = new EnumMap<>(Priority.class);

  public PriorityLanes() {
    for (Priority priority : Priority.values()) {
      lanes.put(priority, new ArrayDeque<>());
    }
  }

  public synchronized void offer(QueuedMessage queued) {
    Objects.requireNonNull(queued, "queued");
    lanes.get(queued.priority()).addLast(queued);
  }

  public synchronized Optional<QueuedMessage> poll() {
    for (Priority priority : Priority.values()) {
      QueuedMessage next = lanes.get(priority).pollFirst();
      if (next != null) {
        return Optional.of(next);
      }
    }
    return Optional.empty();
  }

  /**
   * Enqueues and takes the head of the highest non-empty lane in one step, so the caller always
   * receives a message (its own, or an older one that outranks it).
   */
  public synchronized QueuedMessage offerAndPoll(QueuedMessage queued) {
    offer(queued);
    return poll().orElseThrow();
  }

  /**
   * Empties every lane without processing, returning what was discarded.
   */
  public synchronized List<QueuedMessage> drainAll() {
    List<QueuedMessage> drained = new ArrayList<>();
    for (Priority priority : Priority.values()) {
      ArrayDeque<QueuedMessage> lane = lanes.get(priority);
      drained.addAll(lane);
      lane.clear();
    }
    return drained;
  }

  public synchronized Map<Priority, Integer> sizes() {
    EnumMap<Priority, Integer> sizes = new EnumMap<>(Priority.class);
    lanes.forEach((priority, lane) -> sizes.put(priority, lane.size()));
    return sizes;
  }

  public synchronized int size() {
    int total = 0;
    for (ArrayDeque<QueuedMessage> lane : lanes.values()) {
      total += lane.size();
    }
    return total;
  }

  public synchronized boolean isEmpty() {
    return size() == 0;
  }
}
