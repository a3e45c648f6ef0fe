package io.agentmesh.bus.model;

import java.util.Locale;

/**
 * Kind of a bus message. The wire form is the lower-case name.
 */
public enum MessageKind {
  REQUEST,
  RESPONSE,
  NOTIFICATION,
  ERROR,
  INITIALIZE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MessageKind fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("kind must not be null or blank");
    }
    String normalised = value.trim().toUpperCase(Locale.ROOT);
    for (MessageKind kind : values()) {
      if (kind.name().equals(normalised)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown message kind: " + value);
  }
}
