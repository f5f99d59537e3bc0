package io.mixforge.track;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Persistent processing state of a track, as stored in the {@link EntityStore}. */
public enum TrackStatus {
  UPLOADED,
  PROCESSING,
  REGENERATE,
  COMPLETED,
  ERROR,
  CANCELLED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
