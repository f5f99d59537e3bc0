package io.mixforge.security;

import java.nio.file.Path;

/**
 * Outcome of a path check. When {@code ok} is true, {@code path} holds the canonical absolute
 * path; otherwise {@code reason} explains the refusal.
 */
public record PathValidation(boolean ok, Path path, String reason) {

  public static PathValidation accepted(Path path) {
    return new PathValidation(true, path, null);
  }

  public static PathValidation rejected(String reason) {
    return new PathValidation(false, null, reason);
  }
}
