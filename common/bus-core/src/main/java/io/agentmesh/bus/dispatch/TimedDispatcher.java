package io.agentmesh.bus.dispatch;

import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.error.AgentHandlerException;
import io.agentmesh.bus.error.DispatchTimeoutException;
import io.agentmesh.bus.model.Message;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes agent handlers on a daemon pool and waits at most the given timeout for the result.
 * A timed-out handler is interrupted but may still complete its side effects.
 */
public final class TimedDispatcher implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TimedDispatcher.class);

  private final ExecutorService executor;

  public TimedDispatcher() {
    this.executor = Executors.newCachedThreadPool(new DispatchThreadFactory());
  }

  public Message dispatch(Agent agent, Message message, Duration timeout) {
    Objects.requireNonNull(agent, "agent");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timeout, "timeout");
    Future<Message> future = executor.submit(() -> agent.handle(message));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new DispatchTimeoutException(agent.id(), timeout);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new AgentHandlerException(agent.id(), cause);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new AgentHandlerException(agent.id(), ex);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
        log.debug("Agent dispatch threads still running after shutdown");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static final class DispatchThreadFactory implements ThreadFactory {

    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, "agent-dispatch-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
