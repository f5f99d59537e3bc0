package io.mixforge.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mixforge.jobs.JobStatus;
import io.mixforge.jobs.Progress;
import java.time.Instant;
import java.util.Locale;

/** A change in a job's progress or status, as delivered to subscribers. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
    Type type,
    String jobId,
    long entityId,
    String ownerId,
    JobStatus status,
    Progress progress,
    String error,
    Instant timestamp) {

  /** Kind of change carried by the event. */
  public enum Type {
    PROGRESS,
    STATUS;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
