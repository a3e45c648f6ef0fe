package io.agentmesh.bus.dispatch;

import java.util.Locale;

/**
 * Dispatch lanes, highest first.
 */
public enum Priority {
  CRITICAL,
  HIGH,
  NORMAL,
  LOW;

  public static Priority fromName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("priority must not be null or blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown priority: " + value, ex);
    }
  }
}
