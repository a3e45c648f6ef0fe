package io.agentmesh.bus.pipeline;

public enum PipelineStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
