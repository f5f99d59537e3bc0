package io.mixforge.jobs;

/** Health verdict derived from {@link QueueStats}. */
public record QueueHealth(
    boolean healthy, QueueStats stats, double maxFailureRate, int maxActiveJobs) {

  static final double MAX_FAILURE_RATE = 10.0;
  static final int MAX_ACTIVE_JOBS = 20;

  static QueueHealth of(QueueStats stats) {
    boolean ok = stats.failureRate() < MAX_FAILURE_RATE && stats.active() < MAX_ACTIVE_JOBS;
    return new QueueHealth(ok, stats, MAX_FAILURE_RATE, MAX_ACTIVE_JOBS);
  }

  public String status() {
    return healthy ? "healthy" : "degraded";
  }
}
