package io.mixforge.exception;

/** A component was used before it was initialized, or after it was shut down. */
public class StateException extends MixForgeException {
  public StateException(String message) {
    super(MixForgeErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(MixForgeErrorCode.STATE_ERROR, message, cause);
  }
}
