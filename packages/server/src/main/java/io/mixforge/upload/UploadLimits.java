package io.mixforge.upload;

import io.mixforge.exception.ConfigException;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Size and format limits applied when an upload session is created.
 *
 * @param maxBytes largest accepted file
 * @param chunkSize buffer size used while streaming a body to disk
 * @param allowedExtensions lower-case extensions including the dot, e.g. {@code .wav}
 */
public record UploadLimits(long maxBytes, int chunkSize, Set<String> allowedExtensions) {

  public static final long DEFAULT_MAX_BYTES = 500L * 1024 * 1024;
  public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
  public static final Set<String> DEFAULT_EXTENSIONS =
      Set.of(".mp3", ".wav", ".flac", ".aiff", ".m4a", ".ogg");

  public UploadLimits {
    if (maxBytes <= 0) throw new ConfigException("upload.max-bytes must be positive");
    if (chunkSize <= 0) throw new ConfigException("upload.chunk-size must be positive");
    if (allowedExtensions == null || allowedExtensions.isEmpty()) {
      throw new ConfigException("upload.allowed-extensions must not be empty");
    }
    allowedExtensions =
        allowedExtensions.stream()
            .map(e -> (e.startsWith(".") ? e : "." + e).toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  public static UploadLimits defaults() {
    return new UploadLimits(DEFAULT_MAX_BYTES, DEFAULT_CHUNK_SIZE, DEFAULT_EXTENSIONS);
  }
}
