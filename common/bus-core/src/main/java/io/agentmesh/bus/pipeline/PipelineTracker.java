package io.agentmesh.bus.pipeline;

import io.agentmesh.bus.events.BusEventTypes;
import io.agentmesh.bus.events.EventLog;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks multi-stage pipelines from start to a terminal state.
 * <p>
 * Running pipelines are mutable and live in the active map. Completing or failing one moves an
 * immutable {@link PipelineSnapshot} to the matching archive; each archive keeps the most recent
 * {@code archiveLimit} entries.
 */
public final class PipelineTracker {

  public static final int DEFAULT_ARCHIVE_LIMIT = 1_000;

  private static final Logger log = LoggerFactory.getLogger(PipelineTracker.class);

  private final int archiveLimit;
  private final Clock clock;
  private final EventLog events;
  private final Map<String, Pipeline> active = new LinkedHashMap<>();
  private final ArrayDeque<PipelineSnapshot> completed = new ArrayDeque<>();
  private final ArrayDeque<PipelineSnapshot> failed = new ArrayDeque<>();
  private long startedCount;
  private long completedCount;
  private long failedCount;

  public PipelineTracker(int archiveLimit, Clock clock, EventLog events) {
    if (archiveLimit < 1) {
      throw new IllegalArgumentException("archiveLimit must be >= 1");
    }
    this.archiveLimit = archiveLimit;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.events = Objects.requireNonNull(events, "events");
  }

  /**
   * Starts a pipeline and returns its id. A {@code null} or blank id is replaced by a generated one.
   */
  public synchronized String start(String pipelineId, Map<String, Object> config) {
    String id = pipelineId == null || pipelineId.isBlank()
        ? "pipeline_" + UUID.randomUUID()
        : pipelineId;
    if (active.containsKey(id)) {
      throw new IllegalStateException("Pipeline " + id + " is already running");
    }
    Pipeline pipeline = new Pipeline(id, config == null ? Map.of() : config, clock.instant());
    active.put(id, pipeline);
    startedCount++;
    events.append(BusEventTypes.PIPELINE_STARTED, Map.of("pipeline_id", id, "config", pipeline.config));
    log.info("Pipeline {} started", id);
    return id;
  }

  public synchronized PipelineSnapshot advanceStage(String pipelineId, int stageIndex, String stageName, Object result) {
    Pipeline pipeline = requireActive(pipelineId);
    if (stageName == null || stageName.isBlank()) {
      throw new IllegalArgumentException("stageName must not be null or blank");
    }
    if (stageIndex != pipeline.currentStage) {
      throw new IllegalStateException("Pipeline " + pipelineId + " expected stage "
          + pipeline.currentStage + " but got " + stageIndex);
    }
    pipeline.stagesCompleted.add(stageName);
    pipeline.results.put(stageName, result);
    pipeline.currentStage++;
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("pipeline_id", pipelineId);
    data.put("stage", stageName);
    data.put("stage_index", stageIndex);
    events.append(BusEventTypes.PIPELINE_STAGE_COMPLETED, data);
    log.debug("Pipeline {} completed stage {} ({})", pipelineId, stageIndex, stageName);
    return pipeline.snapshot();
  }

  public synchronized void recordError(String pipelineId, String error) {
    Pipeline pipeline = requireActive(pipelineId);
    String recorded = error == null ? "unknown error" : error;
    pipeline.errors.add(recorded);
    events.append(BusEventTypes.PIPELINE_ERROR, Map.of("pipeline_id", pipelineId, "error", recorded));
    log.debug("Pipeline {} recorded error: {}", pipelineId, recorded);
  }

  public synchronized PipelineSnapshot complete(String pipelineId) {
    Pipeline pipeline = requireActive(pipelineId);
    PipelineSnapshot snapshot = finish(pipeline, PipelineStatus.COMPLETED);
    archive(completed, snapshot);
    completedCount++;
    events.append(BusEventTypes.PIPELINE_COMPLETED, Map.of(
        "pipeline_id", pipelineId,
        "stages", snapshot.stagesCompleted().size()));
    log.info("Pipeline {} completed after {} stages", pipelineId, snapshot.stagesCompleted().size());
    return snapshot;
  }

  public synchronized PipelineSnapshot fail(String pipelineId, String reason) {
    Pipeline pipeline = requireActive(pipelineId);
    String cause = reason == null || reason.isBlank() ? "unspecified" : reason;
    pipeline.errors.add(cause);
    PipelineSnapshot snapshot = finish(pipeline, PipelineStatus.FAILED);
    archive(failed, snapshot);
    failedCount++;
    events.append(BusEventTypes.PIPELINE_FAILED, Map.of("pipeline_id", pipelineId, "reason", cause));
    log.warn("Pipeline {} failed: {}", pipelineId, cause);
    return snapshot;
  }

  /**
   * Looks a pipeline up in the active map, then in the completed and failed archives.
   */
  public synchronized Optional<PipelineSnapshot> status(String pipelineId) {
    Pipeline pipeline = active.get(pipelineId);
    if (pipeline != null) {
      return Optional.of(pipeline.snapshot());
    }
    Optional<PipelineSnapshot> archived = findArchived(completed, pipelineId);
    return archived.isPresent() ? archived : findArchived(failed, pipelineId);
  }

  public synchronized List<PipelineSnapshot> activePipelines() {
    List<PipelineSnapshot> snapshots = new ArrayList<>(active.size());
    for (Pipeline pipeline : active.values()) {
      snapshots.add(pipeline.snapshot());
    }
    return List.copyOf(snapshots);
  }

  public synchronized List<PipelineSnapshot> completedPipelines() {
    return List.copyOf(completed);
  }

  public synchronized List<PipelineSnapshot> failedPipelines() {
    return List.copyOf(failed);
  }

  public synchronized Counts counts() {
    return new Counts(active.size(), startedCount, completedCount, failedCount);
  }

  private Pipeline requireActive(String pipelineId) {
    Pipeline pipeline = active.get(pipelineId);
    if (pipeline != null) {
      return pipeline;
    }
    if (findArchived(completed, pipelineId).isPresent() || findArchived(failed, pipelineId).isPresent()) {
      throw new IllegalStateException("Pipeline " + pipelineId + " has already finished");
    }
    throw new IllegalArgumentException("Unknown pipeline: " + pipelineId);
  }

  private PipelineSnapshot finish(Pipeline pipeline, PipelineStatus status) {
    active.remove(pipeline.id);
    pipeline.status = status;
    pipeline.finishedAt = clock.instant();
    return pipeline.snapshot();
  }

  private void archive(ArrayDeque<PipelineSnapshot> archive, PipelineSnapshot snapshot) {
    if (archive.size() == archiveLimit) {
      archive.pollFirst();
    }
    archive.addLast(snapshot);
  }

  private static Optional<PipelineSnapshot> findArchived(ArrayDeque<PipelineSnapshot> archive, String pipelineId) {
    Iterator<PipelineSnapshot> newestFirst = archive.descendingIterator();
    while (newestFirst.hasNext()) {
      PipelineSnapshot snapshot = newestFirst.next();
      if (snapshot.id().equals(pipelineId)) {
        return Optional.of(snapshot);
      }
    }
    return Optional.empty();
  }

  public record Counts(int active, long started, long completed, long failed) {
  }

  private static final class Pipeline {

    private final String id;
    private final Map<String, Object> config;
    private final Instant startedAt;
    private final List<String> stagesCompleted = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<String, Object> results = new LinkedHashMap<>();
    private PipelineStatus status = PipelineStatus.RUNNING;
    private int currentStage;
    private Instant finishedAt;

    private Pipeline(String id, Map<String, Object> config, Instant startedAt) {
      this.id = id;
      this.config = new LinkedHashMap<>(config);
      this.startedAt = startedAt;
    }

    private PipelineSnapshot snapshot() {
      return new PipelineSnapshot(id, config, status, currentStage, stagesCompleted, errors,
          results, startedAt, finishedAt);
    }
  }
}
