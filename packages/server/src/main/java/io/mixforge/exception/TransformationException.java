package io.mixforge.exception;

/** The external transformation could not be started or reported a failure. */
public class TransformationException extends MixForgeException {
  public TransformationException(String message) {
    super(MixForgeErrorCode.TRANSFORMATION_ERROR, message);
  }

  public TransformationException(String message, Throwable cause) {
    super(MixForgeErrorCode.TRANSFORMATION_ERROR, message, cause);
  }
}
