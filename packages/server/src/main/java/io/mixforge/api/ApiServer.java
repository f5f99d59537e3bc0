package io.mixforge.api;

import io.mixforge.api.endpoints.BulkProcessingServlet;
import io.mixforge.api.endpoints.EventsServlet;
import io.mixforge.api.endpoints.HealthServlet;
import io.mixforge.api.endpoints.JobsServlet;
import io.mixforge.api.endpoints.QueueControlServlet;
import io.mixforge.api.endpoints.QueueStatsServlet;
import io.mixforge.api.endpoints.TracksServlet;
import io.mixforge.api.endpoints.UploadInitServlet;
import io.mixforge.api.endpoints.UploadServlet;
import io.mixforge.jobs.JobManager;
import io.mixforge.lifecycle.CleanupSweeper;
import io.mixforge.track.EntityStore;
import io.mixforge.upload.UploadProgressTracker;
import java.nio.file.Path;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the HTTP API on a Jetty servlet context: track processing, job polling and
 * cancellation, queue administration, live event streams and streaming uploads.
 */
public final class ApiServer {

  /** Settings the endpoints need beyond the services themselves. */
  public record Settings(Path resultsDir, int maxVersions, String adminToken, Duration heartbeat) {}

  private final JobManager jobs;
  private final EntityStore tracks;
  private final UploadProgressTracker uploads;
  private final CleanupSweeper sweeper;
  private final Settings settings;

  public ApiServer(
      JobManager jobs,
      EntityStore tracks,
      UploadProgressTracker uploads,
      CleanupSweeper sweeper,
      Settings settings) {
    this.jobs = jobs;
    this.tracks = tracks;
    this.uploads = uploads;
    this.sweeper = sweeper;
    this.settings = settings;
  }

  private String contextPath() {
    return "/api";
  }

  /** Register all API servlets with the given context. */
  public void register(ServletContextHandler ctx) {
    ctx.addServlet(
        new ServletHolder(
            new TracksServlet(tracks, jobs, settings.resultsDir(), settings.maxVersions())),
        "%s/tracks/*".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(
            new BulkProcessingServlet(tracks, jobs, settings.resultsDir(), settings.maxVersions())),
        "%s/tracks/process-bulk".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new JobsServlet(jobs)), "%s/jobs/*".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new QueueStatsServlet(jobs)),
        "%s/admin/queue-stats".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new QueueControlServlet(sweeper)),
        "%s/admin/queue-control".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new HealthServlet(jobs)),
        "%s/health/job-queue".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new EventsServlet(jobs, settings.adminToken(), settings.heartbeat())),
        "%s/events".formatted(contextPath()));

    // exact mapping wins over the wildcard below
    ctx.addServlet(
        new ServletHolder(new UploadInitServlet(uploads)),
        "%s/streaming/upload/init".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new UploadServlet(uploads, tracks)),
        "%s/streaming/upload/*".formatted(contextPath()));
  }
}
