package io.mixforge.exception;

/** Request content failed validation before any work was scheduled. */
public class ValidationException extends MixForgeException {
  public ValidationException(String message) {
    super(MixForgeErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(MixForgeErrorCode.VALIDATION_ERROR, message, cause);
  }
}
