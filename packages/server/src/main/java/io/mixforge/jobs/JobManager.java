package io.mixforge.jobs;

import io.mixforge.events.EventSink;
import io.mixforge.events.ProgressPublisher;
import io.mixforge.events.PublisherStats;
import io.mixforge.events.Subscription;
import io.mixforge.exception.StateException;
import io.mixforge.logging.LoggingService;
import io.mixforge.track.ProcessingSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Asynchronous job service. Every submission starts executing immediately on its own worker
 * thread; there is no global lock across jobs.
 *
 * <p>Cancellation is cooperative: the registry marks the job cancelled at once, then the worker is
 * interrupted so that a blocking transformation can stop early.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobManager.class);

  static final String DEADLINE_MESSAGE = "Processing deadline exceeded";

  private final JobRegistry registry;
  private final JobRunner runner;
  private final ProgressPublisher publisher;
  private final Duration deadline;
  private final ExecutorService executor;
  private final ScheduledExecutorService deadlines;
  private final Map<String, Future<?>> running = new ConcurrentHashMap<>();

  public JobManager(JobRegistry registry, JobRunner runner, ProgressPublisher publisher) {
    this(registry, runner, publisher, Duration.ZERO);
  }

  /**
   * @param deadline maximum run time of a job; zero or negative disables the limit
   */
  public JobManager(
      JobRegistry registry, JobRunner runner, ProgressPublisher publisher, Duration deadline) {
    this.registry = registry;
    this.runner = runner;
    this.publisher = publisher;
    this.deadline = deadline;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> new Thread(r, "job-runner-" + counter.incrementAndGet()));
    if (deadline.isZero() || deadline.isNegative()) {
      this.deadlines = null;
    } else {
      ScheduledThreadPoolExecutor timer =
          new ScheduledThreadPoolExecutor(
              1,
              r -> {
                Thread t = new Thread(r, "job-deadline");
                t.setDaemon(true);
                return t;
              });
      timer.setRemoveOnCancelPolicy(true);
      this.deadlines = timer;
    }
  }

  public String submitJob(
      long entityId,
      String ownerId,
      String inputPath,
      String outputPath,
      ProcessingSettings parameters,
      JobPriority priority) {
    return submit(
        new JobSubmission(null, entityId, ownerId, inputPath, outputPath, parameters, priority));
  }

  /** Register the job and start executing it. */
  public String submit(JobSubmission submission) {
    String id = registry.submit(submission);
    JobView view =
        registry
            .getStatus(id)
            .orElseThrow(() -> new StateException("Job " + id + " vanished after submission"));
    JobContext ctx =
        new JobContext(
            view, () -> !registry.isActive(id) || Thread.currentThread().isInterrupted());

    FutureTask<Void> task = new FutureTask<>(() -> runner.run(ctx), null);
    running.put(id, task);
    Future<?> timer =
        deadlines == null
            ? null
            : deadlines.schedule(() -> expire(id), deadline.toMillis(), TimeUnit.MILLISECONDS);
    try {
      executor.execute(
          () -> {
            try {
              task.run();
            } finally {
              running.remove(id);
              if (timer != null) timer.cancel(false);
            }
          });
    } catch (RejectedExecutionException e) {
      running.remove(id);
      if (timer != null) timer.cancel(false);
      registry.fail(id, "Server shutdown");
      throw new StateException("Job manager is shut down", e);
    }
    return id;
  }

  private void expire(String jobId) {
    if (registry.fail(jobId, DEADLINE_MESSAGE)) {
      log.warn("Job {} exceeded its deadline of {}s", jobId, deadline.toSeconds());
      interrupt(jobId);
    }
  }

  public Optional<JobView> getJobStatus(String jobId) {
    return registry.getStatus(jobId);
  }

  public List<JobView> list() {
    return registry.list();
  }

  /**
   * Cancel a queued or active job.
   *
   * @return false when the job is unknown or already terminal
   */
  public boolean cancelJob(String jobId) {
    boolean cancelled = registry.cancel(jobId);
    if (cancelled) interrupt(jobId);
    return cancelled;
  }

  private void interrupt(String jobId) {
    Future<?> f = running.get(jobId);
    if (f != null) {
      f.cancel(true);
    }
  }

  public Subscription subscribeToOwnerEvents(String ownerId, EventSink sink) {
    return publisher.subscribe(ownerId, sink);
  }

  public Subscription subscribeToAllEvents(EventSink sink) {
    return publisher.subscribeAll(sink);
  }

  public QueueStats queueStats() {
    return registry.stats();
  }

  public PublisherStats eventStats() {
    return publisher.stats();
  }

  public QueueHealth health() {
    return QueueHealth.of(registry.stats());
  }

  public JobRegistry registry() {
    return registry;
  }

  /** Stop accepting work and interrupt running workers. */
  @Override
  public void close() {
    executor.shutdownNow();
    if (deadlines != null) deadlines.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Job workers did not stop within 5s");
        for (String id : running.keySet()) {
          registry.fail(id, "Server shutdown");
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
