package io.mixforge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception for all MixForge failures. Carries an error code and context. */
public class MixForgeException extends RuntimeException {
  private final MixForgeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MixForgeException(MixForgeErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public MixForgeException(MixForgeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public MixForgeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for chaining. */
  public MixForgeException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
