package io.mixforge.jobs;

import io.mixforge.exception.ValidationException;

/**
 * Ordinal scheduling hint. Every submission starts executing immediately, so priority is recorded
 * and reported but does not reorder work.
 */
public enum JobPriority {
  LOW(1),
  NORMAL(2),
  HIGH(3),
  CRITICAL(4);

  private final int value;

  JobPriority(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  public static JobPriority fromValue(int value) {
    for (JobPriority p : values()) {
      if (p.value == value) return p;
    }
    throw new ValidationException("Invalid priority " + value + ", expected 1-4");
  }
}
