package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.exception.MixForgeException;
import io.mixforge.upload.UploadProgressTracker;
import io.mixforge.upload.UploadSession;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/streaming/upload/init with {@code {filename, fileSize}} opens an upload session. */
public final class UploadInitServlet extends HttpServlet {
  private final UploadProgressTracker uploads;

  public UploadInitServlet(UploadProgressTracker uploads) {
    this.uploads = uploads;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body;
    try {
      body = MAPPER.readTree(req.getInputStream());
    } catch (JsonProcessingException e) {
      ApiResponses.writeError(resp, 400, "Request body must be JSON");
      return;
    }
    if (body == null || !body.hasNonNull("filename") || !body.path("fileSize").canConvertToLong()) {
      ApiResponses.writeError(resp, 400, "filename and fileSize are required");
      return;
    }

    try {
      UploadSession session =
          uploads.init(body.get("filename").asText(), body.get("fileSize").asLong());
      ObjectNode node = MAPPER.createObjectNode();
      node.put("uploadId", session.uploadId());
      node.put("chunkSize", uploads.limits().chunkSize());
      node.put("maxFileSize", uploads.limits().maxBytes());
      ApiResponses.writeJson(resp, 200, node);
    } catch (MixForgeException e) {
      ApiResponses.writeError(resp, e);
    }
  }
}
