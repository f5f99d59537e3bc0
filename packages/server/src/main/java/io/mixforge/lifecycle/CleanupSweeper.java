package io.mixforge.lifecycle;

import io.mixforge.events.InMemoryProgressPublisher;
import io.mixforge.jobs.JobRegistry;
import io.mixforge.logging.LoggingService;
import io.mixforge.upload.UploadProgressTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Bounds memory growth by periodically evicting finished jobs and upload sessions.
 *
 * <p>Only terminal jobs whose finish time is older than the retention window are evicted; a job
 * stuck in {@code active} stays visible. On {@link #shutdown()} every job that is still live is
 * failed with {@value #SHUTDOWN_MESSAGE}.
 */
public final class CleanupSweeper implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(CleanupSweeper.class);

  public static final String SHUTDOWN_MESSAGE = "Server shutdown";

  private final JobRegistry registry;
  private final UploadProgressTracker uploads;
  private final InMemoryProgressPublisher publisher;
  private final Duration interval;
  private final Duration retention;
  private final Clock clock;
  private final Object lifecycleLock = new Object();
  private ScheduledExecutorService scheduler;
  private boolean shutDown;

  public CleanupSweeper(
      JobRegistry registry,
      UploadProgressTracker uploads,
      InMemoryProgressPublisher publisher,
      Duration interval,
      Duration retention,
      Clock clock) {
    this.registry = registry;
    this.uploads = uploads;
    this.publisher = publisher;
    this.interval = interval;
    this.retention = retention;
    this.clock = clock;
  }

  /** Start the periodic sweep. Calling it twice has no effect. */
  public void start() {
    synchronized (lifecycleLock) {
      if (scheduler != null || shutDown) return;
      scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "cleanup-sweeper");
                t.setDaemon(true);
                return t;
              });
      long period = interval.toMillis();
      scheduler.scheduleAtFixedRate(this::sweepSafely, period, period, TimeUnit.MILLISECONDS);
      log.info(
          "Cleanup sweeper running every {} min, retention {} min",
          interval.toMinutes(),
          retention.toMinutes());
    }
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      // an exception would cancel the schedule
      log.error("Cleanup sweep failed", e);
    }
  }

  /**
   * Run one cleanup pass now.
   *
   * @return number of evicted jobs
   */
  public int sweep() {
    Instant cutoff = clock.instant().minus(retention);
    int jobs = registry.evictTerminalBefore(cutoff);
    int sessions = uploads.evictFinishedBefore(cutoff);
    int subscribers = publisher.purgeClosed();
    if (jobs > 0 || sessions > 0) {
      log.info("Cleaned up {} old jobs and {} upload sessions", jobs, sessions);
    }
    log.debug("Sweep done: {} jobs, {} uploads, {} subscribers", jobs, sessions, subscribers);
    return jobs;
  }

  /**
   * Stop sweeping and fail every live job.
   *
   * @return number of jobs that were failed
   */
  public int shutdown() {
    synchronized (lifecycleLock) {
      if (shutDown) return 0;
      shutDown = true;
      if (scheduler != null) {
        scheduler.shutdownNow();
        scheduler = null;
      }
    }
    int failed = registry.failAllLive(SHUTDOWN_MESSAGE);
    log.info("Shutdown marked {} live jobs as failed", failed);
    return failed;
  }

  @Override
  public void close() {
    shutdown();
  }
}
