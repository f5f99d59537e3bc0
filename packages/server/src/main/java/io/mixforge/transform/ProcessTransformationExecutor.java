package io.mixforge.transform;

import com.fasterxml.jackson.databind.JsonNode;
import io.mixforge.exception.TransformationException;
import io.mixforge.logging.LoggingService;
import io.mixforge.track.ProcessingSettings;
import io.mixforge.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Runs the extension script as a child process:
 *
 * <pre>
 * python script.py input output introBars outroBars preserveVocals beatDetection
 * </pre>
 *
 * <p>Every stdout line is forwarded to the listener. The script reports its result as a JSON line
 * such as {@code {"status":"success","output_path":"..."}}; a non-zero exit code or an {@code
 * "error"} status fails the transformation. The process is destroyed when the listener reports
 * cancellation or the waiting thread is interrupted.
 */
public final class ProcessTransformationExecutor implements TransformationExecutor {
  private static final Logger log = LoggingService.getLogger(ProcessTransformationExecutor.class);

  private static final int MAX_STDERR_CHARS = 4000;

  private final String executable;
  private final Path script;
  private final Path workingDir;
  private final Duration pollInterval;

  public ProcessTransformationExecutor(String executable, Path script, Path workingDir) {
    this(executable, script, workingDir, Duration.ofMillis(200));
  }

  public ProcessTransformationExecutor(
      String executable, Path script, Path workingDir, Duration pollInterval) {
    this.executable = executable;
    this.script = script;
    this.workingDir = workingDir;
    this.pollInterval = pollInterval;
    if ("python".equals(executable)) {
      log.warn(
          "Using 'python' from PATH; set transform.python-executable to an absolute interpreter"
              + " path");
    }
  }

  List<String> command(TransformationRequest request) {
    ProcessingSettings s = request.settings();
    return List.of(
        executable,
        script.toString(),
        request.inputPath().toString(),
        request.outputPath().toString(),
        Integer.toString(s.introLength()),
        Integer.toString(s.outroLength()),
        Boolean.toString(s.preserveVocals()),
        s.beatDetection().wireName());
  }

  @Override
  public TransformationOutcome run(TransformationRequest request, TransformationListener listener)
      throws InterruptedException {
    List<String> command = command(request);
    log.info("Job {}: running {}", request.jobId(), String.join(" ", command));

    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDir != null) builder.directory(workingDir.toFile());

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new TransformationException(
          "Failed to start transformation process: " + e.getMessage(), e);
    }

    List<String> stdout = Collections.synchronizedList(new ArrayList<>());
    StringBuilder stderr = new StringBuilder();
    Thread outPump =
        pump(
            process.getInputStream(),
            line -> {
              stdout.add(line);
              listener.onOutput(line);
            },
            "transform-out-" + request.jobId());
    Thread errPump =
        pump(
            process.getErrorStream(),
            line -> {
              synchronized (stderr) {
                if (stderr.length() < MAX_STDERR_CHARS) stderr.append(line).append('\n');
              }
            },
            "transform-err-" + request.jobId());

    try {
      while (!process.waitFor(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
        if (listener.isCancelled()) {
          log.info("Job {}: stopping transformation process after cancellation", request.jobId());
          process.destroyForcibly();
          throw new CancellationException("Cancelled by user");
        }
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
    outPump.join(pollInterval.toMillis() * 10);
    errPump.join(pollInterval.toMillis() * 10);

    int exit = process.exitValue();
    if (exit != 0) {
      String err;
      synchronized (stderr) {
        err = stderr.toString().trim();
      }
      throw new TransformationException(
          "Transformation process failed with exit code %d: %s".formatted(exit, err));
    }
    List<String> lines;
    synchronized (stdout) {
      lines = List.copyOf(stdout);
    }
    return parseOutcome(lines, request.outputPath());
  }

  /** Read the last JSON object printed by the script; fall back to the requested output path. */
  static TransformationOutcome parseOutcome(List<String> lines, Path requestedOutput) {
    for (int i = lines.size() - 1; i >= 0; i--) {
      String line = lines.get(i).trim();
      if (!line.startsWith("{")) continue;
      JsonNode node;
      try {
        node = JacksonUtility.getJsonMapper().readTree(line);
      } catch (IOException e) {
        log.debug("Ignoring non-JSON output line: {}", LoggingService.sanitize(line));
        continue;
      }
      if ("error".equals(node.path("status").asText())) {
        throw new TransformationException(
            node.path("message").asText("Transformation reported an error"));
      }
      Path output =
          node.hasNonNull("output_path") ? Path.of(node.get("output_path").asText()) : null;
      Double duration = node.hasNonNull("duration") ? node.get("duration").asDouble() : null;
      return new TransformationOutcome(output == null ? requestedOutput : output, duration);
    }
    return new TransformationOutcome(requestedOutput, null);
  }

  private static Thread pump(InputStream in, Consumer<String> sink, String name) {
    Thread t =
        new Thread(
            () -> {
              try (BufferedReader reader =
                  new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                  sink.accept(line);
                }
              } catch (IOException e) {
                // stream closes abruptly when the process is destroyed
                log.debug("{} stopped: {}", name, e.toString());
              }
            },
            name);
    t.setDaemon(true);
    t.start();
    return t;
  }
}
