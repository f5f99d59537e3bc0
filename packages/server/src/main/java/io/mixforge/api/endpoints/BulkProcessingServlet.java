package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.exception.MixForgeException;
import io.mixforge.exception.ValidationException;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.JobPriority;
import io.mixforge.logging.LoggingService;
import io.mixforge.track.EntityStore;
import io.mixforge.track.ProcessingSettings;
import io.mixforge.track.TrackRecord;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * POST /api/tracks/process-bulk: queue one extension job per listed track with shared settings.
 *
 * <p>Tracks that cannot be queued do not fail the request; their reasons come back in {@code
 * errors} next to the ids of the jobs that were queued.
 */
public final class BulkProcessingServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(BulkProcessingServlet.class);

  static final int MAX_TRACKS = 10;

  private final EntityStore tracks;
  private final JobManager jobs;
  private final Path resultsDir;
  private final int maxVersions;

  public BulkProcessingServlet(
      EntityStore tracks, JobManager jobs, Path resultsDir, int maxVersions) {
    this.tracks = tracks;
    this.jobs = jobs;
    this.resultsDir = resultsDir;
    this.maxVersions = maxVersions;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body;
    ProcessingSettings settings;
    JobPriority priority;
    boolean useOptimization;
    try {
      body = ApiResponses.readBody(req);
      JsonNode settingsNode = body.path("settings");
      settings =
          settingsNode.isObject()
              ? MAPPER.treeToValue(settingsNode, ProcessingSettings.class)
              : ProcessingSettings.defaults();
      priority =
          body.hasNonNull("priority")
              ? JobPriority.fromValue(body.get("priority").asInt())
              : JobPriority.NORMAL;
      useOptimization = body.path("useOptimization").asBoolean(true);
    } catch (JsonProcessingException e) {
      ValidationException cause = ApiResponses.findValidation(e);
      if (cause != null) {
        ApiResponses.writeError(resp, cause);
      } else {
        ApiResponses.writeError(resp, 400, "Invalid processing settings");
      }
      return;
    } catch (MixForgeException e) {
      ApiResponses.writeError(resp, e);
      return;
    }

    JsonNode trackIds = body.path("trackIds");
    if (!trackIds.isArray() || trackIds.isEmpty()) {
      ApiResponses.writeError(resp, 400, "Invalid track IDs array");
      return;
    }
    if (trackIds.size() > MAX_TRACKS) {
      ApiResponses.writeError(
          resp, 400, "Maximum %d tracks can be processed in bulk".formatted(MAX_TRACKS));
      return;
    }

    String owner = req.getHeader(ApiResponses.OWNER_HEADER);
    List<String> jobIds = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    for (JsonNode rawId : trackIds) {
      String label = rawId.isValueNode() ? rawId.asText() : rawId.toString();
      long id = rawId.isIntegralNumber() ? rawId.asLong() : ApiResponses.parseId(label);
      Optional<TrackRecord> found = id > 0 ? tracks.get(id) : Optional.empty();
      if (found.isEmpty() || (owner != null && !owner.equals(found.get().ownerId()))) {
        errors.add("Track %s not found".formatted(label));
        continue;
      }
      TrackRecord track = found.get();
      if (track.versionCount() > maxVersions) {
        errors.add("Track %d has reached maximum version limit".formatted(track.id()));
        continue;
      }
      try {
        String output = resultsDir.resolve(TracksServlet.outputFilename(track)).toString();
        jobIds.add(
            jobs.submitJob(
                track.id(), track.ownerId(), track.originalPath(), output, settings, priority));
      } catch (MixForgeException e) {
        log.warn("Bulk request could not queue track {}: {}", track.id(), e.getMessage());
        errors.add("Track %d: %s".formatted(track.id(), e.getMessage()));
      }
    }
    log.info(
        "Bulk processing queued {} of {} tracks at priority {}",
        jobIds.size(),
        trackIds.size(),
        priority);

    ObjectNode node = MAPPER.createObjectNode();
    node.put("message", "Bulk processing initiated: %d jobs queued".formatted(jobIds.size()));
    ArrayNode ids = node.putArray("jobIds");
    jobIds.forEach(ids::add);
    node.put("successCount", jobIds.size());
    node.put("errorCount", errors.size());
    if (!errors.isEmpty()) {
      ArrayNode list = node.putArray("errors");
      errors.forEach(list::add);
    }
    node.put("priority", priority.value());
    node.put("useOptimization", useOptimization);
    ApiResponses.writeJson(resp, 202, node);
  }
}
