package io.agentmesh.bus.health;

public enum HealthStatus {
  HEALTHY,
  UNHEALTHY
}
