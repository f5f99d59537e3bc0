package io.mixforge.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time snapshot of a job's progress. Steps are 1-indexed; {@code estimatedTimeRemaining}
 * is a best-effort number of seconds and may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Progress(
    int percentage,
    Stage stage,
    String message,
    int currentStep,
    int totalSteps,
    Long estimatedTimeRemaining) {

  public Progress {
    if (percentage < 0 || percentage > 100) {
      throw new IllegalArgumentException("percentage must be within 0..100: " + percentage);
    }
    if (totalSteps < 1 || currentStep < 1 || currentStep > totalSteps) {
      throw new IllegalArgumentException(
          "invalid step %d of %d".formatted(currentStep, totalSteps));
    }
  }

  public static Progress of(int percentage, Stage stage, String message, int step, int total) {
    return new Progress(percentage, stage, message, step, total, null);
  }

  Progress withPercentage(int value) {
    return new Progress(
        value, stage, message, currentStep, totalSteps, estimatedTimeRemaining);
  }
}
