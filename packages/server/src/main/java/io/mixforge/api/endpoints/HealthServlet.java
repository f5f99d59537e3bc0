package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.QueueHealth;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;

/** GET /api/health/job-queue answers 200 when healthy and 503 when degraded. */
public final class HealthServlet extends HttpServlet {
  private final JobManager jobs;

  public HealthServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    QueueHealth health = jobs.health();
    ObjectNode node = MAPPER.createObjectNode();
    node.put("status", health.status());
    node.put("timestamp", health.stats().timestamp().toString());
    ObjectNode metrics = node.putObject("metrics");
    metrics.put("totalJobs", health.stats().total());
    metrics.put("activeJobs", health.stats().active());
    metrics.put("failedJobs", health.stats().failed());
    metrics.put(
        "failureRate", String.format(Locale.ROOT, "%.2f%%", health.stats().failureRate()));
    ObjectNode thresholds = node.putObject("thresholds");
    thresholds.put(
        "maxFailureRate", String.format(Locale.ROOT, "%.0f%%", health.maxFailureRate()));
    thresholds.put("maxActiveJobs", health.maxActiveJobs());
    ApiResponses.writeJson(resp, health.healthy() ? 200 : 503, node);
  }
}
