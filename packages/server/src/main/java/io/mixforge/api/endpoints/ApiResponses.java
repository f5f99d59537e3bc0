package io.mixforge.api.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.exception.ErrorDetails;
import io.mixforge.exception.ExceptionUtil;
import io.mixforge.exception.MixForgeException;
import io.mixforge.exception.UploadRejectedException;
import io.mixforge.exception.ValidationException;
import io.mixforge.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.regex.Pattern;

/** JSON response helpers shared by the API servlets. */
final class ApiResponses {
  static final ObjectMapper MAPPER = JacksonUtility.getJsonMapper();

  static final String OWNER_HEADER = "X-User-Id";
  static final String DEFAULT_OWNER = "demo";
  static final Pattern JOB_ID = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

  private ApiResponses() {}

  static void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(MAPPER.writeValueAsString(body));
  }

  static void writeError(HttpServletResponse resp, int status, String message)
      throws IOException {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("message", message);
    writeJson(resp, status, node);
  }

  static void writeError(HttpServletResponse resp, MixForgeException e) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(e);
    ObjectNode node = MAPPER.createObjectNode();
    node.put("message", details.message());
    node.put("code", details.code().name());
    if (e instanceof UploadRejectedException rejected) {
      node.put("reason", rejected.getReason().name());
    }
    if (!details.context().isEmpty()) {
      node.set("details", MAPPER.valueToTree(details.context()));
    }
    node.put("timestamp", details.timestamp().toString());
    writeJson(resp, statusFor(e), node);
  }

  static int statusFor(MixForgeException e) {
    switch (e.getCode()) {
      case VALIDATION_ERROR:
      case INVALID_PATH:
        return 400;
      case UPLOAD_REJECTED:
        return ((UploadRejectedException) e).getReason()
                == UploadRejectedException.Reason.FILE_TOO_LARGE
            ? 413
            : 400;
      case STATE_ERROR:
        return 409;
      default:
        return 500;
    }
  }

  /** Path info split into segments, without the leading slash; empty when there is none. */
  static String[] segments(HttpServletRequest req) {
    String info = req.getPathInfo();
    if (info == null || info.length() <= 1) return new String[0];
    return info.substring(1).split("/");
  }

  static String owner(HttpServletRequest req) {
    String owner = req.getHeader(OWNER_HEADER);
    return owner == null || owner.isBlank() ? DEFAULT_OWNER : owner.trim();
  }

  /** Positive numeric id, or -1 when {@code raw} is not one. */
  static long parseId(String raw) {
    try {
      long id = Long.parseLong(raw);
      return id > 0 ? id : -1;
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  /** The JSON object body; an empty or null body reads as an empty object. */
  static JsonNode readBody(HttpServletRequest req) throws IOException {
    if (req.getContentLength() == 0) return MAPPER.createObjectNode();
    JsonNode body = MAPPER.readTree(req.getInputStream());
    if (body == null || body.isMissingNode() || body.isNull()) return MAPPER.createObjectNode();
    if (!body.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    return body;
  }

  /** A validation failure wrapped by Jackson while binding a request body, if any. */
  static ValidationException findValidation(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c instanceof ValidationException v) return v;
    }
    return null;
  }
}
