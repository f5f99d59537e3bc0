package io.mixforge.upload;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/** Mutable tracker entry. Fields other than the finals are guarded by {@code this}. */
final class UploadState {
  final String uploadId;
  final String filename;
  final Path targetPath;
  final long totalBytes;
  final Instant startedAt;

  long bytesReceived;
  UploadStatus status = UploadStatus.UPLOADING;
  String error;
  Instant finishedAt;
  boolean transferring;
  volatile boolean cancelled;

  UploadState(
      String uploadId, String filename, Path targetPath, long totalBytes, Instant startedAt) {
    this.uploadId = uploadId;
    this.filename = filename;
    this.targetPath = targetPath;
    this.totalBytes = totalBytes;
    this.startedAt = startedAt;
  }

  synchronized UploadSession snapshot(Instant now) {
    double percentage = Math.min(100.0, bytesReceived * 100.0 / totalBytes);
    double elapsed = Duration.between(startedAt, now).toMillis() / 1000.0;
    double speed = elapsed > 0 ? bytesReceived / elapsed : 0;
    double eta = speed > 0 ? Math.max(0, totalBytes - bytesReceived) / speed : 0;
    return new UploadSession(
        uploadId,
        filename,
        targetPath,
        totalBytes,
        bytesReceived,
        percentage,
        status,
        error,
        startedAt,
        speed,
        eta);
  }
}
