package io.mixforge.events;

/** Handle returned by a subscribe call; closing it unsubscribes. */
public interface Subscription extends AutoCloseable {
  @Override
  void close();
}
