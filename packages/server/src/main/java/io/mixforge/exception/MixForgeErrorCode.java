package io.mixforge.exception;

/** Stable error codes attached to {@link MixForgeException} and exposed in error responses. */
public enum MixForgeErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  VALIDATION_ERROR,
  INVALID_PATH,
  UPLOAD_REJECTED,
  TRANSFORMATION_ERROR,
  IO_ERROR
}
