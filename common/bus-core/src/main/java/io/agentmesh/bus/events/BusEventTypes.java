package io.agentmesh.bus.events;

/**
 * Event type names appended by the bus.
 */
public final class BusEventTypes {

  public static final String MESSAGE_RECEIVED = "message_received";
  public static final String MESSAGE_HANDLED = "message_handled";
  public static final String MESSAGE_ROUTED = "message_routed";
  public static final String MESSAGE_FAILED = "message_failed";
  public static final String MESSAGE_SKIPPED = "message_skipped";

  public static final String CIRCUIT_OPENED = "circuit_opened";
  public static final String CIRCUIT_HALF_OPEN = "circuit_half_open";
  public static final String CIRCUIT_CLOSED = "circuit_closed";
  public static final String CIRCUIT_RESET = "circuit_reset";

  public static final String PIPELINE_STARTED = "pipeline_started";
  public static final String PIPELINE_STAGE_COMPLETED = "pipeline_stage_completed";
  public static final String PIPELINE_ERROR = "pipeline_error";
  public static final String PIPELINE_COMPLETED = "pipeline_completed";
  public static final String PIPELINE_FAILED = "pipeline_failed";

  public static final String AGENT_REGISTERED = "agent_registered";
  public static final String AGENT_UNREGISTERED = "agent_unregistered";
  public static final String EMERGENCY_SHUTDOWN = "emergency_shutdown";
  public static final String HEALTH_CHECK = "health_check";

  private BusEventTypes() {
  }
}
