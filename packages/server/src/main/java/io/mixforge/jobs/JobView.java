package io.mixforge.jobs;

import io.mixforge.track.ProcessingSettings;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Read-only snapshot of a job. {@code progress} is only reported while the job is live or
 * completed, {@code error} only once it failed or was cancelled.
 */
public record JobView(
    String jobId,
    long entityId,
    String ownerId,
    JobStatus status,
    JobPriority priority,
    Progress progress,
    String error,
    Path inputPath,
    Path outputPath,
    ProcessingSettings settings,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt) {

  static JobView fromRecord(JobRecord r) {
    JobStatus status = r.status;
    boolean errored = status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    return new JobView(
        r.id,
        r.entityId,
        r.ownerId,
        status,
        r.priority,
        errored ? null : r.progress,
        errored ? r.error : null,
        r.inputPath,
        r.outputPath,
        r.settings,
        r.createdAt,
        r.startedAt,
        r.finishedAt);
  }
}
