package io.mixforge.jobs;

import io.mixforge.track.ProcessingSettings;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Internal in-memory representation of a job. This is intentionally package-private: every
 * mutation goes through {@link JobRegistry} while holding {@link #lock}.
 */
final class JobRecord {
  final String id;
  final long entityId;
  final String ownerId;
  final Path inputPath;
  final Path outputPath;
  final ProcessingSettings settings;
  final JobPriority priority;
  final Instant createdAt;

  final Object lock = new Object();

  volatile JobStatus status = JobStatus.QUEUED;
  volatile Progress progress;
  volatile String error;
  volatile Instant startedAt;
  volatile Instant finishedAt;

  JobRecord(
      String id,
      long entityId,
      String ownerId,
      Path inputPath,
      Path outputPath,
      ProcessingSettings settings,
      JobPriority priority,
      Instant createdAt) {
    this.id = id;
    this.entityId = entityId;
    this.ownerId = ownerId;
    this.inputPath = inputPath;
    this.outputPath = outputPath;
    this.settings = settings;
    this.priority = priority;
    this.createdAt = createdAt;
  }
}
