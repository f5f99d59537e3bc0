package io.mixforge.jobs;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Lifecycle state of a background job. */
public enum JobStatus {
  /** Job accepted but not yet executing. */
  QUEUED,
  /** Job is executing or about to execute. */
  ACTIVE,
  /** Job finished successfully. */
  COMPLETED,
  /** Job failed permanently. See the job error for details. */
  FAILED,
  /** Job was cancelled by user request. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /** Whether the state machine allows moving from this state to {@code next}. */
  public boolean canTransitionTo(JobStatus next) {
    return successors().contains(next);
  }

  private Set<JobStatus> successors() {
    switch (this) {
      case QUEUED:
        return EnumSet.of(ACTIVE, FAILED, CANCELLED);
      case ACTIVE:
        return EnumSet.of(COMPLETED, FAILED, CANCELLED);
      default:
        return EnumSet.noneOf(JobStatus.class);
    }
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
