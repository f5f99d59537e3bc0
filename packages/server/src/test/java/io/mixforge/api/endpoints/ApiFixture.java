package io.mixforge.api.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import io.mixforge.api.ApiServer;
import io.mixforge.events.InMemoryProgressPublisher;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.JobRegistry;
import io.mixforge.jobs.JobRunner;
import io.mixforge.lifecycle.CleanupSweeper;
import io.mixforge.security.SecurePathValidator;
import io.mixforge.track.InMemoryEntityStore;
import io.mixforge.transform.TransformationExecutor;
import io.mixforge.upload.UploadLimits;
import io.mixforge.upload.UploadProgressTracker;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;

/** Full API wired on a {@link ServletTester} with in-memory services. */
final class ApiFixture implements AutoCloseable {
  static final String ADMIN_TOKEN = "s3cret";

  final Path uploadsDir;
  final Path resultsDir;
  final InMemoryEntityStore tracks = new InMemoryEntityStore();
  final InMemoryProgressPublisher publisher = new InMemoryProgressPublisher(Runnable::run);
  final JobRegistry registry;
  final JobManager jobs;
  final UploadProgressTracker uploads;
  final CleanupSweeper sweeper;
  final ServletTester tester = new ServletTester();

  ApiFixture(Path root, TransformationExecutor executor) throws Exception {
    uploadsDir = Files.createDirectories(root.resolve("uploads"));
    resultsDir = Files.createDirectories(root.resolve("results"));
    Clock clock = Clock.systemUTC();
    SecurePathValidator validator = new SecurePathValidator(List.of(uploadsDir, resultsDir));
    registry = new JobRegistry(tracks, publisher, validator, clock);
    jobs =
        new JobManager(
            registry,
            new JobRunner(registry, tracks, executor, path -> Optional.empty(), clock),
            publisher);
    uploads =
        new UploadProgressTracker(
            new UploadLimits(1024, 16, Set.of(".wav", ".mp3")), validator, uploadsDir, clock);
    sweeper =
        new CleanupSweeper(
            registry, uploads, publisher, Duration.ofMinutes(30), Duration.ofHours(1), clock);

    new ApiServer(
            jobs,
            tracks,
            uploads,
            sweeper,
            new ApiServer.Settings(resultsDir, 3, ADMIN_TOKEN, Duration.ofMillis(50)))
        .register(tester.getContext());
    tester.start();
  }

  HttpTester.Response request(String method, String uri) throws Exception {
    return request(method, uri, null, Map.of());
  }

  HttpTester.Response request(String method, String uri, String body, Map<String, String> headers)
      throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    headers.forEach(req::setHeader);
    if (body != null) {
      req.setHeader("Content-Type", "application/json");
      req.setContent(body.getBytes(StandardCharsets.UTF_8));
    }
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  static JsonNode json(HttpTester.Response resp) throws Exception {
    return ApiResponses.MAPPER.readTree(resp.getContent());
  }

  @Override
  public void close() throws Exception {
    tester.stop();
    jobs.close();
    publisher.close();
  }
}
