package io.mixforge.events;

import io.mixforge.logging.LoggingService;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;

/**
 * In-process {@link ProgressPublisher} keyed by owner id.
 *
 * <p>Events are handed to a dispatcher and delivered there, so publishing returns immediately. The
 * default dispatcher is a single thread, which keeps every job's events in the order they were
 * published. Sinks that throw are skipped; sinks that report themselves closed are removed.
 */
public final class InMemoryProgressPublisher implements ProgressPublisher, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(InMemoryProgressPublisher.class);

  private final Map<String, Set<EventSink>> byOwner = new ConcurrentHashMap<>();
  private final Set<EventSink> broadcast = new CopyOnWriteArraySet<>();
  private final Executor dispatcher;
  private final ExecutorService ownedDispatcher;

  public InMemoryProgressPublisher() {
    this.ownedDispatcher =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "progress-publisher");
              t.setDaemon(true);
              return t;
            });
    this.dispatcher = ownedDispatcher;
  }

  /** Use the given dispatcher; it must run tasks in submission order to keep per-job ordering. */
  public InMemoryProgressPublisher(Executor dispatcher) {
    this.dispatcher = dispatcher;
    this.ownedDispatcher = null;
  }

  @Override
  public void publish(String ownerId, JobEvent event) {
    try {
      dispatcher.execute(() -> deliver(ownerId, event));
    } catch (RejectedExecutionException e) {
      log.debug("Dropping event for job {}: publisher is closed", event.jobId());
    }
  }

  private void deliver(String ownerId, JobEvent event) {
    Set<EventSink> sinks = ownerId == null ? null : byOwner.get(ownerId);
    if (sinks != null) {
      for (EventSink sink : sinks) {
        if (!send(sink, event)) unsubscribe(ownerId, sink);
      }
    }
    for (EventSink sink : broadcast) {
      if (!send(sink, event)) broadcast.remove(sink);
    }
  }

  /** Returns false when the sink should be dropped. */
  private static boolean send(EventSink sink, JobEvent event) {
    if (!sink.isOpen()) return false;
    try {
      sink.accept(event);
    } catch (Exception e) {
      log.debug("Subscriber missed event for job {}: {}", event.jobId(), e.toString());
    }
    return sink.isOpen();
  }

  @Override
  public Subscription subscribe(String ownerId, EventSink sink) {
    // add inside compute so a concurrent unsubscribe cannot drop the set between lookup and add
    byOwner.compute(
        ownerId,
        (k, sinks) -> {
          Set<EventSink> target = sinks != null ? sinks : new CopyOnWriteArraySet<>();
          target.add(sink);
          return target;
        });
    log.debug("Subscriber registered for owner {}", LoggingService.sanitize(ownerId));
    return () -> unsubscribe(ownerId, sink);
  }

  @Override
  public void unsubscribe(String ownerId, EventSink sink) {
    byOwner.computeIfPresent(
        ownerId,
        (k, sinks) -> {
          sinks.remove(sink);
          return sinks.isEmpty() ? null : sinks;
        });
  }

  @Override
  public Subscription subscribeAll(EventSink sink) {
    broadcast.add(sink);
    return () -> unsubscribeAll(sink);
  }

  @Override
  public void unsubscribeAll(EventSink sink) {
    broadcast.remove(sink);
  }

  /**
   * Drop every sink that reports itself closed.
   *
   * @return number of sinks removed
   */
  public int purgeClosed() {
    int removed = 0;
    for (Map.Entry<String, Set<EventSink>> entry : byOwner.entrySet()) {
      for (EventSink sink : entry.getValue()) {
        if (!sink.isOpen()) {
          unsubscribe(entry.getKey(), sink);
          removed++;
        }
      }
    }
    for (EventSink sink : broadcast) {
      if (!sink.isOpen() && broadcast.remove(sink)) removed++;
    }
    if (removed > 0) {
      log.info("Removed {} stale event subscribers", removed);
    }
    return removed;
  }

  @Override
  public PublisherStats stats() {
    int subscribers = byOwner.values().stream().mapToInt(Set::size).sum();
    return new PublisherStats(byOwner.size(), subscribers, broadcast.size());
  }

  @Override
  public void close() {
    if (ownedDispatcher != null) {
      ownedDispatcher.shutdown();
    }
  }
}
