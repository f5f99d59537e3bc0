package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.lifecycle.CleanupSweeper;
import io.mixforge.logging.LoggingService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * POST /api/admin/queue-control with {@code {"action":"cleanup"}} runs a sweep immediately. Jobs
 * start as soon as they are submitted, so pausing or resuming is not supported.
 */
public final class QueueControlServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(QueueControlServlet.class);

  private final CleanupSweeper sweeper;

  public QueueControlServlet(CleanupSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String action;
    try {
      JsonNode body = MAPPER.readTree(req.getInputStream());
      action = body == null ? "" : body.path("action").asText("");
    } catch (JsonProcessingException e) {
      ApiResponses.writeError(resp, 400, "Request body must be JSON");
      return;
    }

    if (!"cleanup".equals(action)) {
      ApiResponses.writeError(
          resp,
          400,
          "Unsupported action '%s'; supported: cleanup".formatted(LoggingService.sanitize(action)));
      return;
    }
    int evicted = sweeper.sweep();
    log.info("Manual cleanup evicted {} jobs", evicted);
    ObjectNode node = MAPPER.createObjectNode();
    node.put("action", action);
    node.put("evictedJobs", evicted);
    ApiResponses.writeJson(resp, 200, node);
  }
}
