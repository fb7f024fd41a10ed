package io.windowstats.event;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands events to a delegate on a single background thread. {@link #emit} never blocks: when the
 * queue is full, or after {@link #close()}, the event is dropped and counted.
 */
public class AsyncEventSink implements EventSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncEventSink.class);

  public static final int DEFAULT_CAPACITY = 1024;

  private final EventSink delegate;
  private final ThreadPoolExecutor executor;
  private final Duration shutdownTimeout;
  private final AtomicLong droppedEvents = new AtomicLong(0);

  public AsyncEventSink(EventSink delegate) {
    this(delegate, DEFAULT_CAPACITY, Duration.ofSeconds(5));
  }

  public AsyncEventSink(EventSink delegate, int capacity, Duration shutdownTimeout) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.delegate = Preconditions.checkNotNull(delegate, "delegate");
    this.shutdownTimeout = Preconditions.checkNotNull(shutdownTimeout, "shutdownTimeout");
    this.executor =
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(capacity),
            new ThreadFactoryBuilder().setNameFormat("event-sink-%d").setDaemon(true).build(),
            new ThreadPoolExecutor.AbortPolicy());
  }

  @Override
  public void emit(Event event) {
    try {
      executor.execute(() -> deliver(event));
    } catch (RejectedExecutionException e) {
      long dropped = droppedEvents.incrementAndGet();
      log.warn(
          "Dropped {} event '{}' (total dropped: {})",
          event.getType(),
          event.getMessage(),
          dropped);
    }
  }

  private void deliver(Event event) {
    try {
      delegate.emit(event);
    } catch (RuntimeException e) {
      log.warn("Event delivery failed for {} event '{}'", event.getType(), event.getMessage(), e);
    }
  }

  public long getDroppedEvents() {
    return droppedEvents.get();
  }

  public int getPendingEvents() {
    return executor.getQueue().size();
  }

  /** Delivers the queued events, waiting up to the shutdown timeout. */
  @Override
  public void close() {
    try {
      log.debug("Shutting down event sink...");
      executor.shutdown();

      if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        int pending = executor.shutdownNow().size();
        droppedEvents.addAndGet(pending);
        log.warn("Event sink did not drain within {}, dropped {} events", shutdownTimeout, pending);
      } else {
        log.debug("Event sink shut down successfully");
      }
    } catch (InterruptedException e) {
      log.warn("Event sink shutdown was interrupted, forcing immediate shutdown");
      Thread.currentThread().interrupt();
      droppedEvents.addAndGet(executor.shutdownNow().size());
    }
  }
}
