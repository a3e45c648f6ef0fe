package io.agentmesh.bus.breaker;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN
}
