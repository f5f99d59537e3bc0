package io.mixforge.jobs;

import java.time.Instant;

/** Counts of tracked jobs per status. */
public record QueueStats(
    int total,
    int queued,
    int active,
    int completed,
    int failed,
    int cancelled,
    Instant timestamp) {

  /** Failed share of all tracked jobs, in percent. */
  public double failureRate() {
    return total == 0 ? 0.0 : failed * 100.0 / total;
  }
}
