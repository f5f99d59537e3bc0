package io.mixforge.exception;

/** Missing or malformed configuration. */
public class ConfigException extends MixForgeException {
  public ConfigException(String message) {
    super(MixForgeErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MixForgeErrorCode.CONFIG_ERROR, message, cause);
  }
}
