package io.mixforge.upload;

import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.InvalidPathException;
import io.mixforge.exception.IoException;
import io.mixforge.exception.StateException;
import io.mixforge.exception.UploadRejectedException;
import io.mixforge.exception.UploadRejectedException.Reason;
import io.mixforge.exception.ValidationException;
import io.mixforge.logging.LoggingService;
import io.mixforge.security.PathMode;
import io.mixforge.security.PathValidation;
import io.mixforge.security.PathValidator;
import io.mixforge.security.SecurePathValidator;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Tracks raw byte transfer of uploads before any job exists.
 *
 * <p>Sessions live only in memory. A rejected {@link #init} leaves no trace. Cancelling a session
 * removes it, stops an in-flight {@link #transfer} at its next chunk and deletes the partially
 * written file.
 */
public final class UploadProgressTracker {
  private static final Logger log = LoggingService.getLogger(UploadProgressTracker.class);

  private static final SecureRandom RANDOM = new SecureRandom();

  private final UploadLimits limits;
  private final PathValidator pathValidator;
  private final Path uploadsDir;
  private final Clock clock;
  private final Map<String, UploadState> sessions = new ConcurrentHashMap<>();

  public UploadProgressTracker(
      UploadLimits limits, PathValidator pathValidator, Path uploadsDir, Clock clock) {
    this.limits = limits;
    this.pathValidator = pathValidator;
    this.uploadsDir = uploadsDir;
    this.clock = clock;
  }

  public UploadLimits limits() {
    return limits;
  }

  /**
   * Open a session for a file of {@code totalBytes}.
   *
   * @throws UploadRejectedException when the size or format is not acceptable
   * @throws InvalidPathException when the target file would land outside the allowed directories
   */
  public UploadSession init(String filename, long totalBytes) {
    if (filename == null || filename.isBlank()) {
      throw new UploadRejectedException(Reason.INVALID_REQUEST, "Filename is required");
    }
    if (totalBytes <= 0) {
      throw new UploadRejectedException(Reason.INVALID_REQUEST, "File size must be positive");
    }
    if (totalBytes > limits.maxBytes()) {
      throw new UploadRejectedException(
              Reason.FILE_TOO_LARGE,
              "File size exceeds maximum allowed size of %d bytes".formatted(limits.maxBytes()))
          .withContext("maxFileSize", limits.maxBytes());
    }
    String safeName = SecurePathValidator.sanitizeFilename(filename);
    String extension = extension(safeName);
    if (safeName.isEmpty() || !limits.allowedExtensions().contains(extension)) {
      List<String> allowed = List.copyOf(new TreeSet<>(limits.allowedExtensions()));
      throw new UploadRejectedException(
              Reason.UNSUPPORTED_FORMAT,
              "Unsupported file format '%s'. Allowed: %s"
                  .formatted(extension, String.join(", ", allowed)))
          .withContext("allowedExtensions", allowed);
    }

    byte[] idBytes = new byte[16];
    RANDOM.nextBytes(idBytes);
    String uploadId = HexFormat.of().formatHex(idBytes);
    Path target = uploadsDir.resolve(uploadId + "_" + UUID.randomUUID() + extension);
    PathValidation validation = pathValidator.validate(target.toString(), PathMode.WRITE);
    if (!validation.ok()) {
      throw new InvalidPathException(target.toString(), validation.reason());
    }

    UploadState state =
        new UploadState(uploadId, safeName, validation.path(), totalBytes, clock.instant());
    sessions.put(uploadId, state);
    log.info(
        "Upload {} started: {} ({} bytes)",
        uploadId,
        LoggingService.sanitize(safeName),
        totalBytes);
    return state.snapshot(clock.instant());
  }

  private static String extension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
  }

  /**
   * Account for {@code delta} newly received bytes. Ignored for unknown sessions, sessions that
   * are no longer uploading, and non-positive deltas.
   */
  public Optional<UploadSession> onBytesReceived(String uploadId, long delta) {
    UploadState s = sessions.get(uploadId);
    if (s == null) return Optional.empty();
    synchronized (s) {
      if (delta > 0 && s.status == UploadStatus.UPLOADING) {
        s.bytesReceived += delta;
      }
    }
    return Optional.of(s.snapshot(clock.instant()));
  }

  /**
   * Stream {@code body} into the session's target file, reporting every chunk. On any failure the
   * partial file is deleted and the session is marked {@code error}; on success it moves to
   * {@code processing}.
   *
   * @return the written file
   */
  public Path transfer(String uploadId, InputStream body) {
    UploadState s = sessions.get(uploadId);
    if (s == null) {
      throw new StateException("Unknown upload: " + uploadId);
    }
    synchronized (s) {
      if (s.cancelled || s.status != UploadStatus.UPLOADING || s.transferring) {
        throw new StateException("Upload " + uploadId + " is not accepting data");
      }
      s.transferring = true;
    }

    byte[] buffer = new byte[limits.chunkSize()];
    try (OutputStream out =
        Files.newOutputStream(
            s.targetPath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      int n;
      while ((n = body.read(buffer)) != -1) {
        checkNotCancelled(s);
        long received;
        synchronized (s) {
          received = s.bytesReceived;
        }
        if (received + n > s.totalBytes) {
          throw new ValidationException(
              "Upload exceeds announced size of %d bytes".formatted(s.totalBytes));
        }
        out.write(buffer, 0, n);
        onBytesReceived(uploadId, n);
      }
      checkNotCancelled(s);
      synchronized (s) {
        if (s.bytesReceived < s.totalBytes) {
          throw new ValidationException(
              "Upload ended after %d of %d bytes".formatted(s.bytesReceived, s.totalBytes));
        }
        s.status = UploadStatus.PROCESSING;
        s.transferring = false;
      }
      log.info("Upload {} received {} bytes", uploadId, s.totalBytes);
      return s.targetPath;
    } catch (IOException e) {
      abort(s, "Failed to store upload: " + e.getMessage());
      throw new IoException("Failed to store upload " + uploadId, e);
    } catch (RuntimeException e) {
      abort(s, ExceptionUtil.extractErrorMessage(e));
      throw e;
    }
  }

  private static void checkNotCancelled(UploadState s) {
    if (s.cancelled) {
      throw new StateException("Upload " + s.uploadId + " was cancelled");
    }
  }

  private void abort(UploadState s, String message) {
    deletePartial(s);
    synchronized (s) {
      s.transferring = false;
      if (!s.cancelled) {
        s.status = UploadStatus.ERROR;
        s.error = message;
        s.finishedAt = clock.instant();
      }
    }
    log.warn("Upload {} aborted: {}", s.uploadId, message);
  }

  /**
   * Record the final outcome of an upload. Completing an upload does not create a job.
   *
   * @param outcome {@link UploadStatus#COMPLETED} or {@link UploadStatus#ERROR}
   * @return false when the session is unknown or already finished
   */
  public boolean finish(String uploadId, UploadStatus outcome, String error) {
    if (!outcome.isFinished()) {
      throw new IllegalArgumentException("Not a final upload status: " + outcome);
    }
    UploadState s = sessions.get(uploadId);
    if (s == null) return false;
    synchronized (s) {
      if (s.status.isFinished()) return false;
      s.status = outcome;
      s.error = outcome == UploadStatus.ERROR ? error : null;
      s.finishedAt = clock.instant();
    }
    log.info("Upload {} finished: {}", uploadId, outcome.wireName());
    return true;
  }

  /**
   * Remove the session, stop any in-flight transfer and delete the partial file.
   *
   * @return false when no such session exists
   */
  public boolean cancel(String uploadId) {
    UploadState s = sessions.remove(uploadId);
    if (s == null) return false;
    synchronized (s) {
      s.cancelled = true;
      if (!s.status.isFinished()) {
        s.status = UploadStatus.ERROR;
        s.error = "Upload cancelled";
        s.finishedAt = clock.instant();
      }
    }
    deletePartial(s);
    log.info("Upload {} cancelled", uploadId);
    return true;
  }

  private static void deletePartial(UploadState s) {
    try {
      Files.deleteIfExists(s.targetPath);
    } catch (IOException e) {
      log.error("Could not delete partial upload {}", s.targetPath, e);
    }
  }

  public Optional<UploadSession> get(String uploadId) {
    UploadState s = sessions.get(uploadId);
    return s == null ? Optional.empty() : Optional.of(s.snapshot(clock.instant()));
  }

  /** Sessions still uploading or processing. */
  public List<UploadSession> active() {
    Instant now = clock.instant();
    return sessions.values().stream()
        .map(s -> s.snapshot(now))
        .filter(s -> !s.status().isFinished())
        .toList();
  }

  /**
   * Drop a finished session once its result has been consumed.
   *
   * @return false when the session is unknown or still running
   */
  public boolean release(String uploadId) {
    UploadState s = sessions.get(uploadId);
    if (s == null) return false;
    synchronized (s) {
      if (!s.status.isFinished()) return false;
    }
    return sessions.remove(uploadId, s);
  }

  /** Forget finished sessions whose outcome is older than {@code cutoff}. */
  public int evictFinishedBefore(Instant cutoff) {
    int evicted = 0;
    for (UploadState s : sessions.values()) {
      boolean stale;
      synchronized (s) {
        stale = s.status.isFinished() && s.finishedAt != null && s.finishedAt.isBefore(cutoff);
      }
      if (stale && sessions.remove(s.uploadId, s)) evicted++;
    }
    return evicted;
  }
}
