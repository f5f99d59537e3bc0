package io.mixforge.jobs;

import io.mixforge.events.JobEvent;
import io.mixforge.events.ProgressPublisher;
import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.InvalidPathException;
import io.mixforge.exception.StateException;
import io.mixforge.exception.ValidationException;
import io.mixforge.logging.LoggingService;
import io.mixforge.security.PathMode;
import io.mixforge.security.PathValidation;
import io.mixforge.security.PathValidator;
import io.mixforge.track.EntityStore;
import io.mixforge.track.TrackRecord;
import io.mixforge.track.TrackStatus;
import io.mixforge.track.TrackUpdate;
import io.mixforge.transform.TransformationOutcome;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;

/**
 * Owns every job record and is the only component allowed to change one.
 *
 * <p>Jobs move along {@code queued -> active -> completed | failed | cancelled}. All mutations of a
 * job happen while holding that job's lock, so when two transitions race (a cancel and a
 * completion, say) the first one wins and the second returns {@code false} without changing
 * anything. Events are handed to the {@link ProgressPublisher} under the same lock, which keeps a
 * job's events in production order and guarantees nothing is published after its terminal event.
 */
public final class JobRegistry {
  private static final Logger log = LoggingService.getLogger(JobRegistry.class);

  public static final String CANCELLED_MESSAGE = "Cancelled by user";
  static final String COMPLETED_MESSAGE = "Processing completed successfully!";

  private final JobStore store;
  private final EntityStore entities;
  private final ProgressPublisher publisher;
  private final PathValidator pathValidator;
  private final Clock clock;
  private final Object submitLock = new Object();

  public JobRegistry(
      EntityStore entities, ProgressPublisher publisher, PathValidator pathValidator, Clock clock) {
    this(new InMemoryJobStore(), entities, publisher, pathValidator, clock);
  }

  JobRegistry(
      JobStore store,
      EntityStore entities,
      ProgressPublisher publisher,
      PathValidator pathValidator,
      Clock clock) {
    this.store = store;
    this.entities = entities;
    this.publisher = publisher;
    this.pathValidator = pathValidator;
    this.clock = clock;
  }

  /**
   * Validate the paths of {@code submission}, store a new job and make it active.
   *
   * @return the job id
   * @throws InvalidPathException when either path is refused; no job is created
   * @throws ValidationException when the requested job id is already taken
   * @throws StateException when a live job already targets the same output path
   */
  public String submit(JobSubmission submission) {
    Path input = checkPath(submission.inputPath(), PathMode.READ);
    Path output = checkPath(submission.outputPath(), PathMode.WRITE);

    String id =
        submission.jobId() != null ? submission.jobId() : generateId(submission.entityId());
    JobRecord record =
        new JobRecord(
            id,
            submission.entityId(),
            submission.ownerId(),
            input,
            output,
            submission.settings(),
            submission.priority(),
            clock.instant());
    synchronized (submitLock) {
      Optional<JobRecord> writer =
          store.all().stream()
              .filter(r -> !r.status.isTerminal() && r.outputPath.equals(output))
              .findFirst();
      if (writer.isPresent()) {
        throw new StateException(
                "Job %s is already writing %s".formatted(writer.get().id, output.getFileName()))
            .withContext("jobId", writer.get().id);
      }
      if (!store.putIfAbsent(record)) {
        throw new ValidationException("Job id already in use: " + id);
      }
    }

    synchronized (record.lock) {
      transition(record, JobStatus.ACTIVE);
      record.startedAt = clock.instant();
      publishStatus(record);
    }
    log.info(
        "Job {} submitted for track {} (priority {})", id, record.entityId, record.priority);
    return id;
  }

  private Path checkPath(String raw, PathMode mode) {
    PathValidation result = pathValidator.validate(raw, mode);
    if (!result.ok()) {
      log.warn(
          "Rejected {} path {}: {}", mode, LoggingService.sanitize(raw), result.reason());
      throw new InvalidPathException(raw, result.reason());
    }
    return result.path();
  }

  private static String generateId(long entityId) {
    String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    return "audio_%d_%d_%s".formatted(entityId, System.currentTimeMillis(), suffix);
  }

  public Optional<JobView> getStatus(String jobId) {
    return store.get(jobId).map(JobView::fromRecord);
  }

  /** All tracked jobs, oldest first. */
  public List<JobView> list() {
    return store.all().stream()
        .sorted(Comparator.comparing((JobRecord r) -> r.createdAt))
        .map(JobView::fromRecord)
        .toList();
  }

  public boolean isActive(String jobId) {
    return store.get(jobId).map(r -> r.status == JobStatus.ACTIVE).orElse(false);
  }

  public boolean isCancelled(String jobId) {
    return store.get(jobId).map(r -> r.status == JobStatus.CANCELLED).orElse(false);
  }

  /**
   * Record that execution started and mark the track as being processed.
   *
   * @return false when the job is unknown or no longer active
   */
  public boolean begin(String jobId, TrackStatus trackStatus) {
    Optional<JobRecord> found = store.get(jobId);
    if (found.isEmpty()) return false;
    JobRecord r = found.get();
    synchronized (r.lock) {
      if (r.status != JobStatus.ACTIVE) return false;
      entities.updateStatus(r.entityId, TrackUpdate.started(trackStatus, r.settings));
      return true;
    }
  }

  /**
   * Store and publish a progress snapshot. Ignored when the job is unknown, not active, or the
   * update would move the percentage backwards. Only completion reaches 100, so anything higher
   * than 99 is clamped.
   *
   * @return whether the update was applied
   */
  public boolean updateProgress(String jobId, Progress progress) {
    Optional<JobRecord> found = store.get(jobId);
    if (found.isEmpty()) return false;
    JobRecord r = found.get();
    synchronized (r.lock) {
      if (r.status != JobStatus.ACTIVE) {
        log.debug("Ignoring progress for job {} in state {}", jobId, r.status);
        return false;
      }
      Progress next =
          progress.percentage() > 99 ? progress.withPercentage(99) : progress;
      if (r.progress != null && next.percentage() < r.progress.percentage()) {
        log.debug(
            "Ignoring regressing progress for job {}: {} < {}",
            jobId,
            next.percentage(),
            r.progress.percentage());
        return false;
      }
      r.progress = next;
      publish(r, JobEvent.Type.PROGRESS);
      return true;
    }
  }

  /**
   * Cancel a queued or active job.
   *
   * @return false when the job is unknown or already terminal
   */
  public boolean cancel(String jobId) {
    Optional<JobRecord> found = store.get(jobId);
    if (found.isEmpty()) return false;
    JobRecord r = found.get();
    synchronized (r.lock) {
      if (!transition(r, JobStatus.CANCELLED)) return false;
      r.error = CANCELLED_MESSAGE;
      r.finishedAt = clock.instant();
      persistQuietly(r, TrackUpdate.status(TrackStatus.CANCELLED));
      publishStatus(r);
    }
    log.info("Job {} cancelled", jobId);
    return true;
  }

  /**
   * Persist the result and mark the job completed at 100%. If the result cannot be persisted the
   * job fails instead.
   *
   * @return whether the job is now completed
   */
  public boolean complete(String jobId, TransformationOutcome outcome) {
    Optional<JobRecord> found = store.get(jobId);
    if (found.isEmpty()) return false;
    JobRecord r = found.get();
    synchronized (r.lock) {
      if (!r.status.canTransitionTo(JobStatus.COMPLETED)) {
        log.debug("Job {} is {}, not completing", jobId, r.status);
        return false;
      }
      Path output = outcome.outputPath() != null ? outcome.outputPath() : r.outputPath;
      Optional<TrackRecord> stored;
      try {
        stored =
            entities.updateStatus(
                r.entityId, TrackUpdate.completed(output.toString(), outcome.durationSeconds()));
      } catch (RuntimeException e) {
        log.error("Job {}: failed to persist result", jobId, e);
        failLocked(r, "Failed to save processing result: " + ExceptionUtil.extractErrorMessage(e));
        return false;
      }
      if (stored.isEmpty()) {
        failLocked(r, "Track " + r.entityId + " no longer exists");
        return false;
      }

      r.progress =
          new Progress(
              100, Stage.COMPLETED, COMPLETED_MESSAGE, JobRunner.TOTAL_STEPS, JobRunner.TOTAL_STEPS,
              0L);
      transition(r, JobStatus.COMPLETED);
      r.finishedAt = clock.instant();
      publish(r, JobEvent.Type.PROGRESS);
      publishStatus(r);
    }
    log.info("Job {} completed: {}", jobId, r.outputPath);
    return true;
  }

  /**
   * Mark the job failed with {@code message} and record the error on the track.
   *
   * @return false when the job is unknown or already terminal
   */
  public boolean fail(String jobId, String message) {
    Optional<JobRecord> found = store.get(jobId);
    if (found.isEmpty()) return false;
    JobRecord r = found.get();
    synchronized (r.lock) {
      if (!r.status.canTransitionTo(JobStatus.FAILED)) {
        log.debug("Job {} is {}, not failing it", jobId, r.status);
        return false;
      }
      failLocked(r, message);
    }
    return true;
  }

  private void failLocked(JobRecord r, String message) {
    transition(r, JobStatus.FAILED);
    r.error = message == null || message.isBlank() ? "Unknown error" : message;
    r.finishedAt = clock.instant();
    persistQuietly(r, TrackUpdate.status(TrackStatus.ERROR));
    publishStatus(r);
    log.warn("Job {} failed: {}", r.id, r.error);
  }

  /** Force every non-terminal job into {@code failed} with the given reason. */
  public int failAllLive(String reason) {
    int failed = 0;
    for (JobRecord r : store.all()) {
      if (!r.status.isTerminal() && fail(r.id, reason)) failed++;
    }
    return failed;
  }

  /**
   * Forget terminal jobs that finished before {@code cutoff}. Live jobs are never evicted.
   *
   * @return number of evicted jobs
   */
  public int evictTerminalBefore(Instant cutoff) {
    int evicted = 0;
    for (JobRecord r : store.all()) {
      synchronized (r.lock) {
        if (r.status.isTerminal() && r.finishedAt != null && r.finishedAt.isBefore(cutoff)) {
          store.remove(r.id);
          evicted++;
        }
      }
    }
    return evicted;
  }

  public QueueStats stats() {
    int queued = 0, active = 0, completed = 0, failed = 0, cancelled = 0;
    for (JobRecord r : store.all()) {
      switch (r.status) {
        case QUEUED -> queued++;
        case ACTIVE -> active++;
        case COMPLETED -> completed++;
        case FAILED -> failed++;
        case CANCELLED -> cancelled++;
      }
    }
    int total = queued + active + completed + failed + cancelled;
    return new QueueStats(total, queued, active, completed, failed, cancelled, clock.instant());
  }

  private static boolean transition(JobRecord r, JobStatus next) {
    if (!r.status.canTransitionTo(next)) {
      log.debug("Rejected transition {} -> {} for job {}", r.status, next, r.id);
      return false;
    }
    r.status = next;
    return true;
  }

  private void persistQuietly(JobRecord r, TrackUpdate update) {
    try {
      entities.updateStatus(r.entityId, update);
    } catch (RuntimeException e) {
      log.error(
          "Job {}: could not record status {} for track {}", r.id, update.status(), r.entityId, e);
    }
  }

  private void publishStatus(JobRecord r) {
    publish(r, JobEvent.Type.STATUS);
  }

  private void publish(JobRecord r, JobEvent.Type type) {
    JobView view = JobView.fromRecord(r);
    JobEvent event =
        new JobEvent(
            type,
            r.id,
            r.entityId,
            r.ownerId,
            view.status(),
            view.progress(),
            view.error(),
            clock.instant());
    try {
      publisher.publish(r.ownerId, event);
    } catch (RuntimeException e) {
      log.debug("Publishing {} event for job {} failed: {}", type, r.id, e.toString());
    }
  }
}
