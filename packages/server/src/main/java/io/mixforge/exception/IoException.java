package io.mixforge.exception;

/** Unchecked wrapper for filesystem failures inside the upload and job pipelines. */
public class IoException extends MixForgeException {
  public IoException(String message) {
    super(MixForgeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(MixForgeErrorCode.IO_ERROR, message, cause);
  }
}
