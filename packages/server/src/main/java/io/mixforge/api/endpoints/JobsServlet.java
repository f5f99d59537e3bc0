package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.JobView;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/** GET /api/jobs/{jobId}/status polls a job; DELETE /api/jobs/{jobId} cancels it. */
public final class JobsServlet extends HttpServlet {
  private final JobManager jobs;

  public JobsServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length != 2 || !"status".equals(path[1])) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    String jobId = path[0];
    if (!ApiResponses.JOB_ID.matcher(jobId).matches()) {
      ApiResponses.writeError(resp, 400, "Invalid job ID format");
      return;
    }
    Optional<JobView> view = jobs.getJobStatus(jobId);
    if (view.isEmpty()) {
      ApiResponses.writeError(resp, 404, "Job not found");
      return;
    }

    JobView v = view.get();
    ObjectNode node = MAPPER.createObjectNode();
    node.put("jobId", v.jobId());
    node.put("trackId", v.entityId());
    node.put("status", v.status().wireName());
    node.put("priority", v.priority().value());
    if (v.progress() != null) node.set("progress", MAPPER.valueToTree(v.progress()));
    if (v.error() != null) node.put("error", v.error());
    node.put("createdAt", v.createdAt().toString());
    if (v.startedAt() != null) node.put("startedAt", v.startedAt().toString());
    if (v.finishedAt() != null) node.put("finishedAt", v.finishedAt().toString());
    ApiResponses.writeJson(resp, 200, node);
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length != 1) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    String jobId = path[0];
    if (!ApiResponses.JOB_ID.matcher(jobId).matches()) {
      ApiResponses.writeError(resp, 400, "Invalid job ID format");
      return;
    }
    if (!jobs.cancelJob(jobId)) {
      ApiResponses.writeError(resp, 404, "Job not found or already completed");
      return;
    }
    ObjectNode node = MAPPER.createObjectNode();
    node.put("jobId", jobId);
    node.put("cancelled", true);
    ApiResponses.writeJson(resp, 200, node);
  }
}
