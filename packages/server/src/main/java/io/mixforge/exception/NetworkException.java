package io.mixforge.exception;

/** Errors starting or stopping network listeners. */
public class NetworkException extends MixForgeException {
  public NetworkException(String message) {
    super(MixForgeErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(MixForgeErrorCode.NETWORK_ERROR, message, cause);
  }
}
