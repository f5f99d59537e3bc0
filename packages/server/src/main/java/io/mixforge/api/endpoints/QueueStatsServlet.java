package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.events.PublisherStats;
import io.mixforge.jobs.JobManager;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /api/admin/queue-stats: job counts plus live event stream connections. */
public final class QueueStatsServlet extends HttpServlet {
  private final JobManager jobs;

  public QueueStatsServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = MAPPER.valueToTree(jobs.queueStats());
    PublisherStats events = jobs.eventStats();
    ObjectNode connections = node.putObject("connections");
    connections.put("owners", events.owners());
    connections.put("ownerSubscribers", events.ownerSubscribers());
    connections.put("broadcastSubscribers", events.broadcastSubscribers());
    connections.put("total", events.ownerSubscribers() + events.broadcastSubscribers());
    ApiResponses.writeJson(resp, 200, node);
  }
}
