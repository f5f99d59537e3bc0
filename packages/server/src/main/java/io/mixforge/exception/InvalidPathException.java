package io.mixforge.exception;

/**
 * A filesystem path was refused by the path validator. The path is never read or written once
 * this is raised.
 */
public class InvalidPathException extends MixForgeException {
  private final String path;

  public InvalidPathException(String path, String reason) {
    super(MixForgeErrorCode.INVALID_PATH, "Invalid path: " + reason);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
