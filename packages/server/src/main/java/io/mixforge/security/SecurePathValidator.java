package io.mixforge.security;

import io.mixforge.exception.ConfigException;
import io.mixforge.logging.LoggingService;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * {@link PathValidator} that only accepts paths inside a fixed set of allowed directories.
 *
 * <p>Raw input is screened for traversal sequences, encoded separators, null bytes and characters
 * that are unsafe on common filesystems before it is canonicalized. Write access additionally
 * requires an existing, writable parent directory.
 */
public final class SecurePathValidator implements PathValidator {
  private static final Logger log = LoggingService.getLogger(SecurePathValidator.class);

  static final int MAX_PATH_LENGTH = 4096;

  private static final List<Pattern> BLOCKED_PATTERNS =
      List.of(
          Pattern.compile("\\.\\."),
          Pattern.compile("~[/\\\\]"),
          Pattern.compile("\u0000"),
          Pattern.compile("%00"),
          Pattern.compile("%2e%2e", Pattern.CASE_INSENSITIVE),
          Pattern.compile("%2f", Pattern.CASE_INSENSITIVE),
          Pattern.compile("%5c", Pattern.CASE_INSENSITIVE),
          Pattern.compile("[<>\"|*?]"));

  private static final Pattern RESERVED_NAME =
      Pattern.compile("^(CON|PRN|AUX|NUL|COM[1-9]|LPT[1-9])$", Pattern.CASE_INSENSITIVE);

  private final List<Path> allowedDirectories;

  public SecurePathValidator(List<Path> allowedDirectories) {
    if (allowedDirectories == null || allowedDirectories.isEmpty()) {
      throw new ConfigException("At least one allowed directory is required");
    }
    List<Path> dirs = new ArrayList<>();
    for (Path dir : allowedDirectories) {
      String raw = dir.toString();
      if (raw.isBlank() || raw.contains("..") || raw.startsWith("http://")
          || raw.startsWith("https://")) {
        throw new ConfigException("Unsafe allowed directory: " + raw);
      }
      dirs.add(dir.toAbsolutePath().normalize());
    }
    this.allowedDirectories = Collections.unmodifiableList(dirs);
  }

  public List<Path> allowedDirectories() {
    return allowedDirectories;
  }

  @Override
  public PathValidation validate(String input, PathMode mode) {
    if (input == null || input.isBlank()) {
      return PathValidation.rejected("path must be a non-empty string");
    }
    if (input.length() > MAX_PATH_LENGTH) {
      return PathValidation.rejected("path length exceeds maximum (" + MAX_PATH_LENGTH + ")");
    }
    for (Pattern pattern : BLOCKED_PATTERNS) {
      if (pattern.matcher(input).find()) {
        return PathValidation.rejected("path contains blocked pattern: " + pattern.pattern());
      }
    }

    Path canonical;
    try {
      canonical = Path.of(input).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      return PathValidation.rejected("path resolution failed: " + e.getReason());
    }

    Path fileName = canonical.getFileName();
    if (fileName != null && RESERVED_NAME.matcher(stripExtension(fileName.toString())).matches()) {
      return PathValidation.rejected("path uses a reserved device name");
    }

    boolean inside =
        allowedDirectories.stream()
            .anyMatch(dir -> canonical.startsWith(dir) && !canonical.equals(dir));
    if (!inside) {
      log.debug("Path {} is outside allowed directories", LoggingService.sanitize(canonical));
      return PathValidation.rejected("path is outside allowed directories");
    }

    if (mode == PathMode.WRITE) {
      Path parent = canonical.getParent();
      if (parent == null || !Files.isDirectory(parent) || !Files.isWritable(parent)) {
        return PathValidation.rejected("parent directory is not writable");
      }
    }
    return PathValidation.accepted(canonical);
  }

  /**
   * Reduce a user-supplied filename to a safe single path segment: dangerous characters, traversal
   * sequences and leading dots are removed, whitespace becomes underscores, length is capped at
   * 255.
   */
  public static String sanitizeFilename(String filename) {
    if (filename == null) {
      throw new IllegalArgumentException("Invalid filename input");
    }
    String s =
        filename
            .replaceAll("[<>:\"/\\\\|?*\u0000]", "")
            .replace("..", "")
            .replaceAll("^\\.+", "")
            .replaceAll("\\s+", "_");
    if (s.length() > 255) s = s.substring(0, 255);
    return s.trim();
  }

  private static String stripExtension(String name) {
    int dot = name.indexOf('.');
    return (dot < 0 ? name : name.substring(0, dot)).toUpperCase(Locale.ROOT);
  }
}
