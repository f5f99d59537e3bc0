package io.mixforge.transform;

import static org.junit.jupiter.api.Assertions.*;

import io.mixforge.exception.TransformationException;
import io.mixforge.track.BeatDetection;
import io.mixforge.track.ProcessingSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ProcessTransformationExecutorTest {

  @TempDir Path dir;

  private static final class CollectingListener implements TransformationListener {
    final List<String> lines = new CopyOnWriteArrayList<>();
    volatile boolean cancelled;

    @Override
    public void onOutput(String line) {
      lines.add(line);
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }

  private TransformationRequest request() {
    return new TransformationRequest(
        "job-1",
        dir.resolve("in.wav"),
        dir.resolve("out.wav"),
        new ProcessingSettings(8, 32, false, BeatDetection.MADMOM));
  }

  private ProcessTransformationExecutor shell(String body) throws Exception {
    Path script = Files.writeString(dir.resolve("extend.sh"), body);
    return new ProcessTransformationExecutor("sh", script, dir, Duration.ofMillis(20));
  }

  @Test
  @DisplayName("the command line carries paths and settings in positional order")
  void commandLine() {
    ProcessTransformationExecutor executor =
        new ProcessTransformationExecutor("python3", Path.of("scripts/p.py"), null);

    assertEquals(
        List.of(
            "python3",
            "scripts/p.py",
            dir.resolve("in.wav").toString(),
            dir.resolve("out.wav").toString(),
            "8",
            "32",
            "false",
            "madmom"),
        executor.command(request()));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("stdout lines are forwarded and the JSON result line is parsed")
  void successfulRun() throws Exception {
    ProcessTransformationExecutor executor =
        shell(
            "echo \"Loading $1\"\n"
                + "echo \"Intro $3 bars, outro $4 bars\"\n"
                + "printf x > \"$2\"\n"
                + "echo '{\"status\":\"success\",\"duration\":12.5}'\n");
    CollectingListener listener = new CollectingListener();

    TransformationOutcome outcome = executor.run(request(), listener);

    assertEquals(dir.resolve("out.wav"), outcome.outputPath());
    assertEquals(12.5, outcome.durationSeconds());
    assertTrue(Files.exists(dir.resolve("out.wav")));
    assertEquals(3, listener.lines.size(), listener.lines.toString());
    assertEquals("Intro 8 bars, outro 32 bars", listener.lines.get(1));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("a non-zero exit fails with the exit code and stderr")
  void nonZeroExit() throws Exception {
    ProcessTransformationExecutor executor = shell("echo 'no tempo found' >&2\nexit 3\n");

    TransformationException e =
        assertThrows(
            TransformationException.class,
            () -> executor.run(request(), new CollectingListener()));

    assertEquals(
        "Transformation process failed with exit code 3: no tempo found", e.getMessage());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("an error status reported by the script fails the transformation")
  void reportedError() throws Exception {
    ProcessTransformationExecutor executor =
        shell("echo '{\"status\":\"error\",\"message\":\"Audio too short\"}'\n");

    TransformationException e =
        assertThrows(
            TransformationException.class,
            () -> executor.run(request(), new CollectingListener()));
    assertEquals("Audio too short", e.getMessage());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("cancellation destroys the running process")
  void cancellationStopsProcess() throws Exception {
    ProcessTransformationExecutor executor = shell("echo started\nsleep 30\n");
    CollectingListener listener = new CollectingListener();
    listener.cancelled = true;

    long start = System.nanoTime();
    assertThrows(CancellationException.class, () -> executor.run(request(), listener));
    assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
  }

  @Test
  @DisplayName("a missing interpreter fails to start")
  void missingInterpreter() {
    ProcessTransformationExecutor executor =
        new ProcessTransformationExecutor(
            dir.resolve("no-such-python").toString(), Path.of("p.py"), dir);

    TransformationException e =
        assertThrows(
            TransformationException.class,
            () -> executor.run(request(), new CollectingListener()));
    assertTrue(e.getMessage().startsWith("Failed to start transformation process"));
  }

  @Test
  @DisplayName("the last JSON line wins and missing fields fall back to the request")
  void parseOutcome() {
    Path requested = Path.of("/data/results/out.wav");

    TransformationOutcome fallback =
        ProcessTransformationExecutor.parseOutcome(List.of("no json here", "{broken"), requested);
    assertEquals(new TransformationOutcome(requested, null), fallback);

    TransformationOutcome parsed =
        ProcessTransformationExecutor.parseOutcome(
            List.of(
                "{\"status\":\"error\",\"message\":\"old\"}",
                "{\"status\":\"success\",\"output_path\":\"/data/results/x.wav\",\"duration\":3}"),
            requested);
    assertEquals(Path.of("/data/results/x.wav"), parsed.outputPath());
    assertEquals(3.0, parsed.durationSeconds());
  }
}
