package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.MixForgeException;
import io.mixforge.logging.LoggingService;
import io.mixforge.track.EntityStore;
import io.mixforge.track.TrackRecord;
import io.mixforge.upload.UploadProgressTracker;
import io.mixforge.upload.UploadSession;
import io.mixforge.upload.UploadStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Upload session endpoints under /api/streaming/upload:
 *
 * <ul>
 *   <li>POST /{uploadId}: raw body transfer; creates the track on success (201)
 *   <li>GET /progress/{uploadId}: session snapshot
 *   <li>GET /active: sessions still uploading or processing
 *   <li>DELETE /{uploadId}: cancel and delete the partial file
 * </ul>
 */
public final class UploadServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(UploadServlet.class);

  private final UploadProgressTracker uploads;
  private final EntityStore tracks;

  public UploadServlet(UploadProgressTracker uploads, EntityStore tracks) {
    this.uploads = uploads;
    this.tracks = tracks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length == 1 && "active".equals(path[0])) {
      ObjectNode node = MAPPER.createObjectNode();
      node.set("uploads", MAPPER.valueToTree(uploads.active()));
      ApiResponses.writeJson(resp, 200, node);
      return;
    }
    if (path.length == 2 && "progress".equals(path[0])) {
      Optional<UploadSession> session = uploads.get(path[1]);
      if (session.isEmpty()) {
        ApiResponses.writeError(resp, 404, "Upload not found");
        return;
      }
      ApiResponses.writeJson(resp, 200, session.get());
      return;
    }
    ApiResponses.writeError(resp, 404, "Not found");
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length != 1) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    String uploadId = path[0];
    Optional<UploadSession> session = uploads.get(uploadId);
    if (session.isEmpty()) {
      ApiResponses.writeError(resp, 404, "Upload not found");
      return;
    }

    Path stored;
    try {
      stored = uploads.transfer(uploadId, req.getInputStream());
    } catch (MixForgeException e) {
      ApiResponses.writeError(resp, e);
      return;
    }

    try {
      TrackRecord track =
          tracks.create(ApiResponses.owner(req), session.get().filename(), stored.toString());
      uploads.finish(uploadId, UploadStatus.COMPLETED, null);
      ObjectNode node = MAPPER.createObjectNode();
      node.put("uploadId", uploadId);
      node.set("track", MAPPER.valueToTree(track));
      ApiResponses.writeJson(resp, 201, node);
    } catch (RuntimeException e) {
      log.error("Upload {} stored but track creation failed", uploadId, e);
      uploads.finish(uploadId, UploadStatus.ERROR, ExceptionUtil.extractErrorMessage(e));
      ApiResponses.writeError(resp, 500, "Failed to register uploaded track");
    }
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length != 1) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    if (!uploads.cancel(path[0])) {
      ApiResponses.writeError(resp, 404, "Upload not found");
      return;
    }
    ObjectNode node = MAPPER.createObjectNode();
    node.put("uploadId", path[0]);
    node.put("cancelled", true);
    ApiResponses.writeJson(resp, 200, node);
  }
}
