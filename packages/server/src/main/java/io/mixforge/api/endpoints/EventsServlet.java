package io.mixforge.api.endpoints;

import io.mixforge.events.SseEventSink;
import io.mixforge.events.Subscription;
import io.mixforge.jobs.JobManager;
import io.mixforge.logging.LoggingService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * GET /api/events?ownerId=... streams the owner's {@code job-update} events as Server-Sent Events.
 * With {@code scope=all} and the configured admin token in {@code X-Admin-Token} the stream carries
 * every event.
 *
 * <p>The request thread stays with the stream and sends a keep-alive comment every heartbeat
 * interval until the client disconnects.
 */
public final class EventsServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(EventsServlet.class);

  static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

  private final JobManager jobs;
  private final String adminToken;
  private final Duration heartbeat;

  public EventsServlet(JobManager jobs, String adminToken, Duration heartbeat) {
    this.jobs = jobs;
    this.adminToken = adminToken;
    this.heartbeat = heartbeat;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    boolean all = "all".equals(req.getParameter("scope"));
    String ownerId = req.getParameter("ownerId");
    if (ownerId == null || ownerId.isBlank()) ownerId = req.getHeader(ApiResponses.OWNER_HEADER);

    if (all) {
      String token = req.getHeader(ADMIN_TOKEN_HEADER);
      if (adminToken == null || adminToken.isBlank() || !adminToken.equals(token)) {
        ApiResponses.writeError(resp, 403, "Admin token required for scope=all");
        return;
      }
    } else if (ownerId == null || ownerId.isBlank()) {
      ApiResponses.writeError(resp, 400, "ownerId is required");
      return;
    }

    resp.setStatus(200);
    resp.setContentType("text/event-stream");
    resp.setCharacterEncoding("UTF-8");
    resp.setHeader("Cache-Control", "no-cache");
    PrintWriter writer = resp.getWriter();
    SseEventSink sink = new SseEventSink(writer);
    sink.heartbeat();

    Subscription subscription =
        all ? jobs.subscribeToAllEvents(sink) : jobs.subscribeToOwnerEvents(ownerId, sink);
    log.debug(
        "Event stream opened for {}", all ? "all owners" : LoggingService.sanitize(ownerId));
    try {
      while (sink.isOpen()) {
        Thread.sleep(heartbeat.toMillis());
        sink.heartbeat();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      subscription.close();
      sink.close();
      log.debug("Event stream closed");
    }
  }
}
