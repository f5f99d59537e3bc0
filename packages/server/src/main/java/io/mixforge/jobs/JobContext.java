package io.mixforge.jobs;

/** Context passed to {@link JobRunner} with the job snapshot and its cancellation flag. */
public final class JobContext {
  private final JobView job;
  private final CancelChecker cancelChecker;

  /** Functional interface checked by the runner to cooperatively cancel execution. */
  @FunctionalInterface
  public interface CancelChecker {
    boolean isCancelled();
  }

  public JobContext(JobView job, CancelChecker cancelChecker) {
    this.job = job;
    this.cancelChecker = cancelChecker;
  }

  public JobView job() {
    return job;
  }

  public String jobId() {
    return job.jobId();
  }

  public boolean isCancelled() {
    return cancelChecker != null && cancelChecker.isCancelled();
  }
}
