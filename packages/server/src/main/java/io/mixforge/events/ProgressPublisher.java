package io.mixforge.events;

/**
 * Decouples "a job changed" from "who needs to know".
 *
 * <p>Delivery is best-effort: no acknowledgement, retry or durability. A subscriber that misses
 * an event recovers the current state by polling the job status. Implementations must never throw
 * from {@link #publish} or block the caller on a slow subscriber.
 */
public interface ProgressPublisher {

  /** Deliver {@code event} to the sinks subscribed under {@code ownerId} and to broadcast sinks. */
  void publish(String ownerId, JobEvent event);

  Subscription subscribe(String ownerId, EventSink sink);

  void unsubscribe(String ownerId, EventSink sink);

  /** Register a privileged sink that receives every event regardless of owner. */
  Subscription subscribeAll(EventSink sink);

  void unsubscribeAll(EventSink sink);

  /** Current subscriber counts, reported next to the queue statistics. */
  PublisherStats stats();
}
