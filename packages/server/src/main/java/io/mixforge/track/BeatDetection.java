package io.mixforge.track;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mixforge.exception.ValidationException;
import java.util.Locale;

/** Beat tracking backend requested from the transformation script. */
public enum BeatDetection {
  AUTO,
  LIBROSA,
  MADMOM;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static BeatDetection fromWire(String value) {
    if (value == null) return AUTO;
    for (BeatDetection b : values()) {
      if (b.wireName().equalsIgnoreCase(value.trim())) return b;
    }
    throw new ValidationException(
        "Invalid beatDetection '%s', expected one of auto, librosa, madmom".formatted(value));
  }
}
