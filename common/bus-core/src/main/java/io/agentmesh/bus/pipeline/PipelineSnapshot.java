package io.agentmesh.bus.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a pipeline. Archived pipelines are kept only in this form.
 */
public record PipelineSnapshot(
    String id,
    Map<String, Object> config,
    PipelineStatus status,
    int currentStage,
    List<String> stagesCompleted,
    List<String> errors,
    Map<String, Object> results,
    Instant startedAt,
    Instant finishedAt
) {

  public PipelineSnapshot {
    config = copy(config);
    stagesCompleted = List.copyOf(stagesCompleted);
    errors = List.copyOf(errors);
    results = copy(results);
  }

  private static Map<String, Object> copy(Map<String, Object> source) {
    return source == null || source.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
