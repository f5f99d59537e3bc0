package io.mixforge.exception;

import java.time.Clock;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Function;

/** Helpers that turn throwables into job error strings, log summaries and error bodies. */
public final class ExceptionUtil {
  private static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, Clock.systemUTC());
  }

  /** Code and context are kept for {@link MixForgeException}s; anything else is UNKNOWN. */
  public static ErrorDetails toErrorDetails(Throwable t, Clock clock) {
    MixForgeErrorCode code = MixForgeErrorCode.UNKNOWN;
    Map<String, Object> context = Map.of();
    if (t instanceof MixForgeException ex) {
      code = ex.getCode();
      context = ex.getContext();
    }
    String message = t.getMessage() == null ? "" : t.getMessage();
    return new ErrorDetails(t.getClass().getSimpleName(), message, code, context, clock.instant());
  }

  /**
   * The top {@code maxFrames} frames joined on one line as {@code Class.method (File:line) > ...}.
   * A non-positive {@code maxFrames} keeps every frame.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    int limit = maxFrames <= 0 ? frames.length : Math.min(frames.length, maxFrames);
    StringJoiner line = new StringJoiner(" > ");
    for (int i = 0; i < limit; i++) {
      StackTraceElement f = frames[i];
      String file = f.getFileName() == null ? "Unknown Source" : f.getFileName();
      String location = f.getLineNumber() >= 0 ? file + ":" + f.getLineNumber() : file;
      line.add(f.getClassName() + "." + f.getMethodName() + " (" + location + ")");
    }
    return line.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  /**
   * Message stored on a failed job or upload. Our own exceptions keep their text as is; foreign
   * ones are prefixed with their simple class name. Never blank.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) return "Unknown error";
    Throwable source = meaningful(t);
    String message = source.getMessage();
    if (message == null || message.isBlank()) {
      return source.getClass().getSimpleName();
    }
    return source instanceof MixForgeException
        ? message
        : source.getClass().getSimpleName() + ": " + message;
  }

  /** Skip wrappers that only repeat their cause, such as {@code UncheckedIOException(e)}. */
  private static Throwable meaningful(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      String message = current.getMessage();
      boolean wrapperOnly =
          message == null || message.isBlank() || message.equals(current.getCause().toString());
      if (!wrapperOnly) break;
      current = current.getCause();
    }
    return current;
  }

  /** Pass {@link MixForgeException}s through; wrap anything else with {@code wrapper}. */
  public static MixForgeException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MixForgeException> wrapper) {
    return t instanceof MixForgeException ex ? ex : wrapper.apply(t);
  }
}
