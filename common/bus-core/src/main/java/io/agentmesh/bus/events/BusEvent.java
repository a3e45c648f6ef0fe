package io.agentmesh.bus.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry in the {@link EventLog}.
 */
public record BusEvent(String id, Instant timestamp, String type, Map<String, Object> data) {

  public BusEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("type must not be null or blank");
    }
    data = data == null || data.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
