package io.agentmesh.bus.runtime;

import io.agentmesh.bus.model.Message;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop draining messages queued with {@link AgentBusController#enqueue}.
 * <p>
 * While the controller is running the pump processes one message at a time and hands each response
 * to the configured consumer. When the lanes are empty it sleeps for the idle interval. It stops on
 * {@link #stop()} or once the controller halts.
 */
public final class BacklogPump implements AutoCloseable {

  public static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofMillis(50);

  private static final Logger log = LoggerFactory.getLogger(BacklogPump.class);

  private final AgentBusController controller;
  private final Duration idleInterval;
  private final Consumer<Message> responses;
  private final ExecutorService executor;
  private Future<?> loop;
  private volatile boolean stopping;

  public BacklogPump(AgentBusController controller, Duration idleInterval, Consumer<Message> responses) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.idleInterval = Objects.requireNonNull(idleInterval, "idleInterval");
    if (idleInterval.isNegative() || idleInterval.isZero()) {
      throw new IllegalArgumentException("idleInterval must be positive");
    }
    this.responses = responses == null ? response -> { } : responses;
    this.executor = Executors.newSingleThreadExecutor(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "agent-bus-pump");
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  public synchronized void start() {
    if (loop != null) {
      return;
    }
    stopping = false;
    loop = executor.submit(this::run);
    log.info("Backlog pump started (idle interval {}ms)", idleInterval.toMillis());
  }

  public synchronized void stop() {
    stopping = true;
    if (loop != null) {
      loop.cancel(true);
      loop = null;
      log.info("Backlog pump stopped");
    }
  }

  public synchronized boolean isRunning() {
    return loop != null && !loop.isDone();
  }

  @Override
  public void close() {
    stop();
    executor.shutdownNow();
  }

  private void run() {
    while (!stopping && controller.isRunning() && !Thread.currentThread().isInterrupted()) {
      Optional<Message> response;
      try {
        response = controller.drainOne();
      } catch (IllegalStateException ex) {
        log.debug("Backlog pump exiting: {}", ex.getMessage());
        return;
      }
      if (response.isPresent()) {
        deliver(response.get());
        continue;
      }
      try {
        Thread.sleep(idleInterval.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
    log.info("Backlog pump finished (controller running: {})", controller.isRunning());
  }

  private void deliver(Message response) {
    try {
      responses.accept(response);
    } catch (RuntimeException ex) {
      log.warn("Response consumer failed for message {}", response.id(), ex);
    }
  }
}
