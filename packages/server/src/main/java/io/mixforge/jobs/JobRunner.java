package io.mixforge.jobs;

import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.IoException;
import io.mixforge.logging.LoggingService;
import io.mixforge.track.EntityStore;
import io.mixforge.track.TrackRecord;
import io.mixforge.track.TrackStatus;
import io.mixforge.transform.AudioDurationProbe;
import io.mixforge.transform.TransformationExecutor;
import io.mixforge.transform.TransformationListener;
import io.mixforge.transform.TransformationOutcome;
import io.mixforge.transform.TransformationRequest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Drives one job through its fixed stages: setup, input validation, transformation, output
 * validation and finalization.
 *
 * <p>Progress checkpoints are reported to the {@link JobRegistry}. During the transformation the
 * real progress of the external process is unknown, so each line it prints advances a synthetic
 * percentage by a fixed step, capped below the output validation stage. This signal is only meant
 * to show that work is happening.
 *
 * <p>{@link #run} never throws for a job failure: every exception ends up as a {@code failed}
 * job.
 */
public final class JobRunner {
  private static final Logger log = LoggingService.getLogger(JobRunner.class);

  static final int TOTAL_STEPS = 6;
  static final int TRANSFORM_START = 30;
  static final int TRANSFORM_STEP = 5;
  static final int TRANSFORM_CAP = 75;

  private final JobRegistry registry;
  private final EntityStore entities;
  private final TransformationExecutor executor;
  private final AudioDurationProbe durationProbe;
  private final Clock clock;

  public JobRunner(
      JobRegistry registry,
      EntityStore entities,
      TransformationExecutor executor,
      AudioDurationProbe durationProbe,
      Clock clock) {
    this.registry = registry;
    this.entities = entities;
    this.executor = executor;
    this.durationProbe = durationProbe;
    this.clock = clock;
  }

  public void run(JobContext ctx) {
    String jobId = ctx.jobId();
    try {
      execute(ctx);
    } catch (CancellationException e) {
      // a no-op for jobs already cancelled or failed; an interrupted worker must not stay active
      if (registry.fail(jobId, "Processing interrupted")) {
        log.warn("Job {} interrupted while running", jobId);
      } else {
        log.info("Job {} stopped: no longer active", jobId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (registry.fail(jobId, "Processing interrupted")) {
        log.warn("Job {} interrupted while running", jobId);
      }
    } catch (Exception e) {
      log.debug("Job {} failed: {}", jobId, ExceptionUtil.formatCompactStackTrace(e));
      registry.fail(jobId, ExceptionUtil.extractErrorMessage(e));
    } catch (Error e) {
      registry.fail(jobId, ExceptionUtil.extractErrorMessage(e));
      throw e;
    }
  }

  private void execute(JobContext ctx) throws InterruptedException {
    JobView job = ctx.job();
    String jobId = job.jobId();
    Instant started = clock.instant();

    TrackStatus startStatus =
        entities.get(job.entityId()).filter(TrackRecord::hasExtendedVersions).isPresent()
            ? TrackStatus.REGENERATE
            : TrackStatus.PROCESSING;
    if (!registry.begin(jobId, startStatus)) {
      throw new CancellationException();
    }
    checkpoint(ctx, started, 10, Stage.SETUP, "Setting up processing environment...", 1);

    checkpoint(ctx, started, 20, Stage.VALIDATING, "Validating audio file...", 2);
    Path input = job.inputPath();
    if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
      throw new IoException("Source audio file not found: " + input);
    }

    checkpoint(ctx, started, TRANSFORM_START, Stage.TRANSFORMING, "Processing audio...", 3);
    Path output = job.outputPath();
    try {
      if (Files.deleteIfExists(output)) {
        log.info("Job {}: removed stale output {}", jobId, output.getFileName());
      }
    } catch (IOException e) {
      throw new IoException("Cannot replace existing output file " + output.getFileName(), e);
    }
    AtomicInteger synthetic = new AtomicInteger(TRANSFORM_START);
    TransformationOutcome outcome =
        executor.run(
            new TransformationRequest(jobId, input, job.outputPath(), job.settings()),
            new TransformationListener() {
              @Override
              public void onOutput(String line) {
                int p = synthetic.updateAndGet(v -> Math.min(TRANSFORM_CAP, v + TRANSFORM_STEP));
                registry.updateProgress(
                    jobId,
                    progress(
                        started, p, Stage.TRANSFORMING, "Audio processing in progress...", 4));
              }

              @Override
              public boolean isCancelled() {
                return ctx.isCancelled();
              }
            });

    checkpoint(ctx, started, 80, Stage.VALIDATING_OUTPUT, "Validating output...", 5);
    if (!Files.isRegularFile(output)) {
      throw new IoException("Processing completed but output file not found");
    }

    checkpoint(ctx, started, 90, Stage.FINALIZING, "Finalizing...", 6);
    Double duration =
        outcome.durationSeconds() != null
            ? outcome.durationSeconds()
            : durationProbe.durationSeconds(output).orElse(null);
    ensureLive(ctx);
    registry.complete(jobId, new TransformationOutcome(output, duration));
  }

  private void checkpoint(
      JobContext ctx, Instant started, int percentage, Stage stage, String message, int step) {
    ensureLive(ctx);
    registry.updateProgress(ctx.jobId(), progress(started, percentage, stage, message, step));
  }

  private static void ensureLive(JobContext ctx) {
    if (ctx.isCancelled()) {
      throw new CancellationException("Cancelled by user");
    }
  }

  private Progress progress(
      Instant started, int percentage, Stage stage, String message, int step) {
    long elapsed = Duration.between(started, clock.instant()).toSeconds();
    Long eta = percentage > 0 ? elapsed * (100 - percentage) / percentage : null;
    return new Progress(percentage, stage, message, step, TOTAL_STEPS, eta);
  }
}
