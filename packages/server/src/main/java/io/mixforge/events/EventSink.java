package io.mixforge.events;

/** Receiver of published job events, typically backed by a push connection. */
public interface EventSink {

  void accept(JobEvent event) throws Exception;

  /** A closed sink is dropped by the publisher the next time it is noticed. */
  default boolean isOpen() {
    return true;
  }
}
