package io.mixforge.upload;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Transfer state of an upload session. */
public enum UploadStatus {
  UPLOADING,
  /** All bytes arrived; the file is being turned into a track. */
  PROCESSING,
  COMPLETED,
  ERROR;

  public boolean isFinished() {
    return this == COMPLETED || this == ERROR;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
