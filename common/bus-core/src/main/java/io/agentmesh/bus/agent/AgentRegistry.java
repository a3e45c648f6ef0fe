package io.agentmesh.bus.agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registered agents keyed by id, with an incrementally maintained {@code role -> ids} index.
 * Registration is last-writer-wins per id.
 */
public final class AgentRegistry {

  private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

  private final Map<String, AgentRegistration> agents = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> roleIndex = new LinkedHashMap<>();

  /**
   * Stores the registration, returning the one it replaced, if any.
   */
  public synchronized Optional<AgentRegistration> register(AgentRegistration registration) {
    AgentRegistration previous = agents.put(registration.agentId(), registration);
    if (previous != null) {
      unindex(previous);
      log.info("Agent {} re-registered (role {} -> {})", registration.agentId(), previous.role(), registration.role());
    }
    roleIndex.computeIfAbsent(registration.role(), role -> new LinkedHashSet<>()).add(registration.agentId());
    return Optional.ofNullable(previous);
  }

  public synchronized Optional<AgentRegistration> unregister(String agentId) {
    AgentRegistration removed = agents.remove(agentId);
    if (removed != null) {
      unindex(removed);
    }
    return Optional.ofNullable(removed);
  }

  public Optional<AgentRegistration> find(String agentId) {
    if (agentId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(agents.get(agentId));
  }

  /**
   * Active agents with the given role, in registration order.
   */
  public synchronized List<AgentRegistration> findByRole(String role) {
    Set<String> ids = roleIndex.get(role);
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    List<AgentRegistration> matches = new ArrayList<>(ids.size());
    for (String id : ids) {
      AgentRegistration registration = agents.get(id);
      if (registration != null && registration.isActive()) {
        matches.add(registration);
      }
    }
    return List.copyOf(matches);
  }

  public synchronized List<AgentRegistration> all() {
    List<AgentRegistration> ordered = new ArrayList<>(agents.size());
    for (Set<String> ids : roleIndex.values()) {
      for (String id : ids) {
        AgentRegistration registration = agents.get(id);
        if (registration != null) {
          ordered.add(registration);
        }
      }
    }
    return List.copyOf(ordered);
  }

  public int size() {
    return agents.size();
  }

  public long activeCount() {
    return agents.values().stream().filter(AgentRegistration::isActive).count();
  }

  private void unindex(AgentRegistration registration) {
    Set<String> ids = roleIndex.get(registration.role());
    if (ids != null) {
      ids.remove(registration.agentId());
      if (ids.isEmpty()) {
        roleIndex.remove(registration.role());
      }
    }
  }

  static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}
