package io.mixforge.events;

import io.mixforge.utility.JacksonUtility;
import java.io.PrintWriter;

/**
 * Writes events to a Server-Sent-Events stream as {@code job-update} messages. The sink closes
 * itself as soon as a write fails, which usually means the client went away.
 */
public final class SseEventSink implements EventSink {
  static final String EVENT_NAME = "job-update";

  private final PrintWriter writer;
  private volatile boolean open = true;

  public SseEventSink(PrintWriter writer) {
    this.writer = writer;
  }

  @Override
  public void accept(JobEvent event) {
    write("event: " + EVENT_NAME + "\ndata: " + JacksonUtility.toJson(event) + "\n\n");
  }

  /** Send an SSE comment line; used as a keep-alive and to detect disconnected clients. */
  public void heartbeat() {
    write(": keep-alive\n\n");
  }

  private void write(String frame) {
    if (!open) return;
    synchronized (writer) {
      writer.write(frame);
      writer.flush();
      if (writer.checkError()) {
        open = false;
      }
    }
  }

  public void close() {
    open = false;
  }

  @Override
  public boolean isOpen() {
    return open;
  }
}
