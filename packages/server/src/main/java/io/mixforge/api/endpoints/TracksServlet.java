package io.mixforge.api.endpoints;

import static io.mixforge.api.endpoints.ApiResponses.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mixforge.exception.MixForgeException;
import io.mixforge.exception.ValidationException;
import io.mixforge.jobs.JobManager;
import io.mixforge.jobs.JobPriority;
import io.mixforge.jobs.JobView;
import io.mixforge.logging.LoggingService;
import io.mixforge.security.SecurePathValidator;
import io.mixforge.track.EntityStore;
import io.mixforge.track.ProcessingSettings;
import io.mixforge.track.TrackRecord;
import io.mixforge.track.TrackStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * GET /api/tracks/{id} returns the track record and GET /api/tracks/{id}/detailed-status adds the
 * live job, if any. POST /api/tracks/{id}/process-async starts an extension job and answers 202
 * right away.
 */
public final class TracksServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(TracksServlet.class);

  private final EntityStore tracks;
  private final JobManager jobs;
  private final Path resultsDir;
  private final int maxVersions;

  public TracksServlet(EntityStore tracks, JobManager jobs, Path resultsDir, int maxVersions) {
    this.tracks = tracks;
    this.jobs = jobs;
    this.resultsDir = resultsDir;
    this.maxVersions = maxVersions;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    boolean detailed = path.length == 2 && "detailed-status".equals(path[1]);
    if (path.length != 1 && !detailed) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    Optional<TrackRecord> track = lookup(path[0], req, resp);
    if (track.isEmpty()) return;
    ApiResponses.writeJson(resp, 200, detailed ? detailedStatus(track.get()) : track.get());
  }

  private ObjectNode detailedStatus(TrackRecord track) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("trackId", track.id());
    node.set("status", MAPPER.valueToTree(track.status()));
    node.put("versionCount", track.versionCount());
    node.put("hasExtended", track.hasExtendedVersions());
    if (track.settings() != null) {
      node.set("settings", MAPPER.valueToTree(track.settings()));
    }

    Optional<JobView> live =
        jobs.list().stream()
            .filter(j -> j.entityId() == track.id() && !j.status().isTerminal())
            .max(Comparator.comparing(JobView::createdAt));
    if (live.isPresent()) {
      JobView job = live.get();
      ObjectNode processing = node.putObject("processing");
      processing.put("active", true);
      processing.put("jobId", job.jobId());
      processing.set("status", MAPPER.valueToTree(job.status()));
      processing.put("priority", job.priority().value());
      if (job.progress() != null) {
        processing.set("progress", MAPPER.valueToTree(job.progress()));
      }
      if (job.startedAt() != null) {
        processing.put("startedAt", job.startedAt().toString());
      }
    } else if (track.status() == TrackStatus.PROCESSING
        || track.status() == TrackStatus.REGENERATE) {
      // marked busy by a job that is no longer tracked here
      ObjectNode processing = node.putObject("processing");
      processing.put("active", true);
      processing.put("message", "Track is being processed in background job queue");
    }
    return node;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] path = ApiResponses.segments(req);
    if (path.length != 2 || !"process-async".equals(path[1])) {
      ApiResponses.writeError(resp, 404, "Not found");
      return;
    }
    Optional<TrackRecord> found = lookup(path[0], req, resp);
    if (found.isEmpty()) return;
    TrackRecord track = found.get();

    if (track.versionCount() > maxVersions) {
      ApiResponses.writeError(
          resp, 400, "Maximum version limit (%d) reached".formatted(maxVersions));
      return;
    }

    try {
      JsonNode body = ApiResponses.readBody(req);
      ProcessingSettings settings = MAPPER.treeToValue(body, ProcessingSettings.class);
      JobPriority priority =
          body.hasNonNull("priority")
              ? JobPriority.fromValue(body.get("priority").asInt())
              : JobPriority.NORMAL;

      String output = resultsDir.resolve(outputFilename(track)).toString();
      String jobId =
          jobs.submitJob(
              track.id(), track.ownerId(), track.originalPath(), output, settings, priority);

      ObjectNode node = MAPPER.createObjectNode();
      node.put("message", "Audio processing job queued successfully");
      node.put("jobId", jobId);
      node.put("trackId", track.id());
      node.put("status", "queued");
      node.put("priority", priority.value());
      ApiResponses.writeJson(resp, 202, node);
    } catch (JsonProcessingException e) {
      ValidationException cause = ApiResponses.findValidation(e);
      if (cause != null) {
        ApiResponses.writeError(resp, cause);
      } else {
        ApiResponses.writeError(resp, 400, "Invalid processing settings");
      }
    } catch (MixForgeException e) {
      log.warn("Could not queue processing for track {}: {}", track.id(), e.getMessage());
      ApiResponses.writeError(resp, e);
    }
  }

  private Optional<TrackRecord> lookup(
      String rawId, HttpServletRequest req, HttpServletResponse resp) throws IOException {
    long id = ApiResponses.parseId(rawId);
    if (id < 0) {
      ApiResponses.writeError(resp, 400, "Invalid track ID: must be a positive integer");
      return Optional.empty();
    }
    Optional<TrackRecord> track = tracks.get(id);
    String owner = req.getHeader(ApiResponses.OWNER_HEADER);
    if (track.isEmpty() || (owner != null && !owner.equals(track.get().ownerId()))) {
      ApiResponses.writeError(resp, 404, "Track not found");
      return Optional.empty();
    }
    return track;
  }

  /** {@code <base>_extended_v<n>.<ext>} where n is the next version number. */
  static String outputFilename(TrackRecord track) {
    String name = SecurePathValidator.sanitizeFilename(track.originalFilename());
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    String ext = dot > 0 ? name.substring(dot) : "";
    return "%s_extended_v%d%s".formatted(base, track.extendedPaths().size() + 1, ext);
  }
}
