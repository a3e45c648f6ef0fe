package io.agentmesh.bus.context;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded key/value scratch space shared by agents through the bus. Writes are last-writer-wins;
 * a written key becomes the newest, and the oldest key is evicted once {@code maxEntries} is
 * exceeded.
 */
public final class SharedContext {

  public static final int DEFAULT_MAX_ENTRIES = 1_024;

  private final int maxEntries;
  private final LinkedHashMap<String, Object> entries = new LinkedHashMap<>();

  public SharedContext(int maxEntries) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    this.maxEntries = maxEntries;
  }

  public synchronized Optional<Object> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  public synchronized boolean contains(String key) {
    return entries.containsKey(key);
  }

  /**
   * Stores the value and returns the one it replaced, if any. A {@code null} value removes the key.
   */
  public synchronized Optional<Object> put(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Object previous = entries.remove(key);
    if (value != null) {
      entries.put(key, value);
      prune();
    }
    return Optional.ofNullable(previous);
  }

  public synchronized Map<String, Object> snapshot() {
    return new LinkedHashMap<>(entries);
  }

  public synchronized int size() {
    return entries.size();
  }

  private void prune() {
    Iterator<String> keys = entries.keySet().iterator();
    while (entries.size() > maxEntries && keys.hasNext()) {
      keys.next();
      keys.remove();
    }
  }
}
