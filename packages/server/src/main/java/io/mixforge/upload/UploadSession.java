package io.mixforge.upload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of an upload. {@code percentage} is {@code min(100, received / total * 100)}; {@code
 * speed} is bytes per second since the session was created and {@code estimatedTimeRemaining} is
 * in seconds (0 while the speed is unknown).
 */
public record UploadSession(
    String uploadId,
    String filename,
    @JsonIgnore Path targetPath,
    long totalBytes,
    long bytesReceived,
    double percentage,
    UploadStatus status,
    String error,
    Instant startedAt,
    double speed,
    double estimatedTimeRemaining) {}
