package io.mixforge.jobs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.mixforge.events.InMemoryProgressPublisher;
import io.mixforge.events.JobEvent;
import io.mixforge.exception.TransformationException;
import io.mixforge.security.SecurePathValidator;
import io.mixforge.testing.MutableClock;
import io.mixforge.testing.RecordingSink;
import io.mixforge.track.InMemoryEntityStore;
import io.mixforge.track.TrackRecord;
import io.mixforge.track.TrackStatus;
import io.mixforge.track.TrackUpdate;
import io.mixforge.transform.AudioDurationProbe;
import io.mixforge.transform.TransformationExecutor;
import io.mixforge.transform.TransformationOutcome;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobRunnerTest {

  @TempDir Path dir;

  private InMemoryEntityStore store;
  private RecordingSink sink;
  private JobRegistry registry;
  private MutableClock clock;
  private TrackRecord track;
  private Path input;
  private Path output;

  @BeforeEach
  void setUp() throws Exception {
    Path uploads = Files.createDirectories(dir.resolve("uploads"));
    Path results = Files.createDirectories(dir.resolve("results"));
    input = Files.writeString(uploads.resolve("track.mp3"), "ID3");
    output = results.resolve("track_extended_v1.mp3");

    clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    store = spy(new InMemoryEntityStore());
    InMemoryProgressPublisher publisher = new InMemoryProgressPublisher(Runnable::run);
    sink = new RecordingSink();
    publisher.subscribe("owner-a", sink);
    registry =
        new JobRegistry(
            store, publisher, new SecurePathValidator(List.of(uploads, results)), clock);
    track = store.create("owner-a", "track.mp3", input.toString());
  }

  private JobView runWith(TransformationExecutor executor) {
    return runWith(executor, path -> Optional.empty());
  }

  private JobView runWith(TransformationExecutor executor, AudioDurationProbe probe) {
    String id =
        registry.submit(
            new JobSubmission(
                null, track.id(), "owner-a", input.toString(), output.toString(), null, null));
    JobView view = registry.getStatus(id).orElseThrow();
    JobRunner runner = new JobRunner(registry, store, executor, probe, clock);
    runner.run(new JobContext(view, () -> !registry.isActive(id)));
    return registry.getStatus(id).orElseThrow();
  }

  /** Executor that prints {@code lines} lines and writes the output file. */
  private static TransformationExecutor writing(int lines, Double duration) {
    return (req, listener) -> {
      for (int i = 0; i < lines; i++) {
        listener.onOutput("line " + i);
      }
      try {
        Files.writeString(req.outputPath(), "audio");
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return new TransformationOutcome(req.outputPath(), duration);
    };
  }

  private List<Integer> percentages(String jobId) {
    return sink.eventsFor(jobId).stream()
        .filter(e -> e.type() == JobEvent.Type.PROGRESS)
        .map(e -> e.progress().percentage())
        .toList();
  }

  @Test
  @DisplayName("a successful run walks every checkpoint and completes at 100%")
  void successfulRun() {
    JobView job = runWith(writing(2, 184.2));

    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(100, job.progress().percentage());

    List<Integer> seen = percentages(job.jobId());
    assertTrue(seen.containsAll(List.of(10, 20, 30, 35, 40, 80, 90, 100)), seen.toString());
    for (int i = 1; i < seen.size(); i++) {
      assertTrue(seen.get(i) >= seen.get(i - 1), "progress went backwards: " + seen);
    }

    TrackRecord stored = store.get(track.id()).orElseThrow();
    assertEquals(TrackStatus.COMPLETED, stored.status());
    assertEquals(List.of(output.toString()), stored.extendedPaths());
    assertEquals(List.of(184.2), stored.extendedDurations());
    verify(store).updateStatus(eq(track.id()), argThat(u -> u.status() == TrackStatus.PROCESSING));
  }

  @Test
  @DisplayName("output lines advance progress in steps but never past 75")
  void syntheticProgressIsCapped() {
    JobView job = runWith(writing(30, null));

    List<Integer> transforming =
        sink.eventsFor(job.jobId()).stream()
            .filter(e -> e.type() == JobEvent.Type.PROGRESS)
            .filter(e -> e.progress().stage() == Stage.TRANSFORMING)
            .map(e -> e.progress().percentage())
            .toList();
    assertEquals(JobRunner.TRANSFORM_CAP, transforming.stream().mapToInt(i -> i).max().orElse(0));
    assertEquals(JobStatus.COMPLETED, job.status());
  }

  @Test
  @DisplayName("the duration probe is used when the executor reports none")
  void durationFromProbe() {
    runWith(writing(0, null), path -> Optional.of(12.5));
    assertEquals(List.of(12.5), store.get(track.id()).orElseThrow().extendedDurations());
  }

  @Test
  @DisplayName("a missing source file fails the job before the transformation starts")
  void missingSourceFails() throws Exception {
    Files.delete(input);
    AtomicBoolean called = new AtomicBoolean();

    JobView job =
        runWith(
            (req, listener) -> {
              called.set(true);
              return new TransformationOutcome(req.outputPath(), null);
            });

    assertEquals(JobStatus.FAILED, job.status());
    assertTrue(job.error().startsWith("Source audio file not found"), job.error());
    assertFalse(called.get());
    assertEquals(TrackStatus.ERROR, store.get(track.id()).orElseThrow().status());
  }

  @Test
  @DisplayName("a transformation that leaves no output file fails the job")
  void missingOutputFails() {
    JobView job = runWith((req, listener) -> new TransformationOutcome(req.outputPath(), 3.0));

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Processing completed but output file not found", job.error());
    assertTrue(store.get(track.id()).orElseThrow().extendedPaths().isEmpty());
  }

  @Test
  @DisplayName("an output file left over from an earlier run does not count as the result")
  void staleOutputIsNotTrusted() throws Exception {
    Files.writeString(output, "old render");

    JobView job = runWith((req, listener) -> new TransformationOutcome(req.outputPath(), 3.0));

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Processing completed but output file not found", job.error());
    assertFalse(Files.exists(output));
  }

  @Test
  @DisplayName("an interrupt seen only through the cancel check still ends the job")
  void interruptFlagFailsJob() {
    String id =
        registry.submit(
            new JobSubmission(
                null, track.id(), "owner-a", input.toString(), output.toString(), null, null));
    JobRunner runner =
        new JobRunner(registry, store, writing(0, null), path -> Optional.empty(), clock);
    JobContext ctx =
        new JobContext(
            registry.getStatus(id).orElseThrow(),
            () -> !registry.isActive(id) || Thread.currentThread().isInterrupted());

    Thread.currentThread().interrupt();
    try {
      runner.run(ctx);
    } finally {
      Thread.interrupted();
    }

    JobView job = registry.getStatus(id).orElseThrow();
    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Processing interrupted", job.error());
    assertEquals(TrackStatus.ERROR, store.get(track.id()).orElseThrow().status());
  }

  @Test
  @DisplayName("an executor failure becomes the job error")
  void executorFailure() {
    JobView job =
        runWith(
            (req, listener) -> {
              throw new TransformationException(
                  "Transformation process failed with exit code 1: bad header");
            });

    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Transformation process failed with exit code 1: bad header", job.error());
  }

  @Test
  @DisplayName("cancelling during the transformation keeps the job cancelled")
  void cancelDuringTransformation() {
    JobView job =
        runWith(
            (req, listener) -> {
              registry.cancel(req.jobId());
              if (listener.isCancelled()) {
                throw new CancellationException("Cancelled by user");
              }
              return new TransformationOutcome(req.outputPath(), null);
            });

    assertEquals(JobStatus.CANCELLED, job.status());
    assertEquals(JobRegistry.CANCELLED_MESSAGE, job.error());
    assertEquals(TrackStatus.CANCELLED, store.get(track.id()).orElseThrow().status());
    verify(store, never())
        .updateStatus(eq(track.id()), argThat(u -> u.status() == TrackStatus.COMPLETED));
  }

  @Test
  @DisplayName("a job cancelled after the executor returns is not completed")
  void cancelAfterExecutorReturns() {
    JobView job =
        runWith(
            (req, listener) -> {
              TransformationOutcome outcome = writing(0, null).run(req, listener);
              registry.cancel(req.jobId());
              return outcome;
            });

    assertEquals(JobStatus.CANCELLED, job.status());
    assertTrue(store.get(track.id()).orElseThrow().extendedPaths().isEmpty());
  }

  @Test
  @DisplayName("an interrupted worker fails the job and keeps its interrupt flag")
  void interruptedWorker() {
    JobView job =
        runWith(
            (req, listener) -> {
              throw new InterruptedException();
            });

    assertTrue(Thread.interrupted());
    assertEquals(JobStatus.FAILED, job.status());
    assertEquals("Processing interrupted", job.error());
  }

  @Test
  @DisplayName("tracks with existing versions are marked as regenerating")
  void regenerateStatusForExtendedTrack() {
    store.updateStatus(track.id(), TrackUpdate.completed("/tmp/previous.mp3", 100.0));

    runWith(writing(0, null));

    verify(store)
        .updateStatus(eq(track.id()), argThat(u -> u.status() == TrackStatus.REGENERATE));
    assertEquals(2, store.get(track.id()).orElseThrow().extendedPaths().size());
  }
}
