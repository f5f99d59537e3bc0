package io.mixforge.api.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.mixforge.jobs.JobPriority;
import io.mixforge.jobs.JobStatus;
import io.mixforge.jobs.JobSubmission;
import io.mixforge.jobs.JobView;
import io.mixforge.track.TrackRecord;
import io.mixforge.track.TrackStatus;
import io.mixforge.track.TrackUpdate;
import io.mixforge.transform.TransformationOutcome;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TracksServletTest {

  @TempDir Path dir;

  private ApiFixture api;
  private TrackRecord track;

  @BeforeEach
  void setUp() throws Exception {
    api =
        new ApiFixture(
            dir,
            (req, listener) -> {
              try {
                Files.writeString(req.outputPath(), "extended");
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
              return new TransformationOutcome(req.outputPath(), 90.0);
            });
    Path input = Files.writeString(api.uploadsDir.resolve("my mix.wav"), "RIFF");
    track = api.tracks.create("alice", "my mix.wav", input.toString());
  }

  @AfterEach
  void tearDown() throws Exception {
    api.close();
  }

  @Test
  @DisplayName("GET returns the track to its owner and hides it from others")
  void getTrack() throws Exception {
    HttpTester.Response ok =
        api.request("GET", "/api/tracks/" + track.id(), null, Map.of("X-User-Id", "alice"));
    assertEquals(200, ok.getStatus());
    JsonNode body = ApiFixture.json(ok);
    assertEquals("my mix.wav", body.get("originalFilename").asText());
    assertEquals("uploaded", body.get("status").asText());

    HttpTester.Response hidden =
        api.request("GET", "/api/tracks/" + track.id(), null, Map.of("X-User-Id", "mallory"));
    assertEquals(404, hidden.getStatus());
    assertEquals("Track not found", ApiFixture.json(hidden).get("message").asText());
  }

  @Test
  @DisplayName("GET rejects non-numeric and unknown ids")
  void invalidIds() throws Exception {
    HttpTester.Response bad = api.request("GET", "/api/tracks/abc");
    assertEquals(400, bad.getStatus());
    assertEquals(
        "Invalid track ID: must be a positive integer",
        ApiFixture.json(bad).get("message").asText());

    assertEquals(400, api.request("GET", "/api/tracks/0").getStatus());
    assertEquals(404, api.request("GET", "/api/tracks/999").getStatus());
  }

  @Test
  @DisplayName("process-async answers 202 with a job id and the job completes")
  void processAsyncQueuesJob() throws Exception {
    HttpTester.Response resp =
        api.request(
            "POST",
            "/api/tracks/" + track.id() + "/process-async",
            "{\"introLength\":32,\"outroLength\":8,\"beatDetection\":\"librosa\",\"priority\":3}",
            Map.of());

    assertEquals(202, resp.getStatus(), resp.getContent());
    JsonNode body = ApiFixture.json(resp);
    assertEquals("queued", body.get("status").asText());
    assertEquals(track.id(), body.get("trackId").asLong());
    assertEquals(3, body.get("priority").asInt());
    String jobId = body.get("jobId").asText();
    assertTrue(ApiResponses.JOB_ID.matcher(jobId).matches(), jobId);

    JobView job = awaitTerminal(jobId);
    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(api.resultsDir.resolve("my_mix_extended_v1.wav"), job.outputPath());
    assertEquals(32, job.settings().introLength());
    TrackRecord stored = api.tracks.get(track.id()).orElseThrow();
    assertEquals(TrackStatus.COMPLETED, stored.status());
    assertEquals(2, stored.versionCount());
  }

  @Test
  @DisplayName("an empty body uses the default settings")
  void processAsyncWithoutBody() throws Exception {
    HttpTester.Response resp =
        api.request("POST", "/api/tracks/" + track.id() + "/process-async");

    assertEquals(202, resp.getStatus(), resp.getContent());
    assertEquals(2, ApiFixture.json(resp).get("priority").asInt());
  }

  @Test
  @DisplayName("invalid settings and priorities are rejected with 400")
  void invalidSettings() throws Exception {
    HttpTester.Response bars =
        api.request(
            "POST",
            "/api/tracks/" + track.id() + "/process-async",
            "{\"introLength\":2}",
            Map.of());
    assertEquals(400, bars.getStatus());
    assertEquals(
        "introLength must be between 8 and 64 bars, got 2",
        ApiFixture.json(bars).get("message").asText());
    assertEquals("introLength", ApiFixture.json(bars).at("/details/field").asText());

    HttpTester.Response priority =
        api.request(
            "POST", "/api/tracks/" + track.id() + "/process-async", "{\"priority\":9}", Map.of());
    assertEquals(400, priority.getStatus());
    assertEquals("VALIDATION_ERROR", ApiFixture.json(priority).get("code").asText());

    assertTrue(api.jobs.list().isEmpty());
  }

  @Test
  @DisplayName("tracks at the version limit cannot be extended again")
  void versionLimit() throws Exception {
    for (int i = 0; i < 3; i++) {
      api.tracks.updateStatus(track.id(), TrackUpdate.completed("/old/v" + i + ".wav", null));
    }

    HttpTester.Response resp =
        api.request("POST", "/api/tracks/" + track.id() + "/process-async");

    assertEquals(400, resp.getStatus());
    assertEquals(
        "Maximum version limit (3) reached", ApiFixture.json(resp).get("message").asText());
  }

  @Test
  @DisplayName("a track whose source lies outside the allowed directories is refused")
  void unsafeSourcePath() throws Exception {
    TrackRecord outside = api.tracks.create("alice", "x.wav", "/etc/passwd");

    HttpTester.Response resp =
        api.request("POST", "/api/tracks/" + outside.id() + "/process-async");

    assertEquals(400, resp.getStatus());
    assertEquals("INVALID_PATH", ApiFixture.json(resp).get("code").asText());
  }

  @Test
  @DisplayName("process-async answers 409 while another live job writes the same version")
  void processAsyncRejectsConcurrentVersion() throws Exception {
    String first =
        api.registry.submit(
            new JobSubmission(
                null,
                track.id(),
                "alice",
                track.originalPath(),
                api.resultsDir.resolve("my_mix_extended_v1.wav").toString(),
                null,
                JobPriority.NORMAL));

    HttpTester.Response resp =
        api.request("POST", "/api/tracks/" + track.id() + "/process-async");

    assertEquals(409, resp.getStatus(), resp.getContent());
    JsonNode body = ApiFixture.json(resp);
    assertEquals("STATE_ERROR", body.get("code").asText());
    assertEquals(first, body.at("/details/jobId").asText());
    assertEquals(1, api.jobs.list().size());
  }

  @Test
  @DisplayName("detailed-status reports the track and its live job")
  void detailedStatusWithLiveJob() throws Exception {
    String jobId =
        api.registry.submit(
            new JobSubmission(
                null,
                track.id(),
                "alice",
                track.originalPath(),
                api.resultsDir.resolve("my_mix_extended_v1.wav").toString(),
                null,
                JobPriority.HIGH));

    HttpTester.Response resp =
        api.request(
            "GET",
            "/api/tracks/" + track.id() + "/detailed-status",
            null,
            Map.of("X-User-Id", "alice"));

    assertEquals(200, resp.getStatus(), resp.getContent());
    JsonNode body = ApiFixture.json(resp);
    assertEquals(track.id(), body.get("trackId").asLong());
    assertEquals("uploaded", body.get("status").asText());
    assertEquals(1, body.get("versionCount").asInt());
    assertFalse(body.get("hasExtended").asBoolean());
    assertTrue(body.at("/processing/active").asBoolean());
    assertEquals(jobId, body.at("/processing/jobId").asText());
    assertEquals("queued", body.at("/processing/status").asText());
    assertEquals(JobPriority.HIGH.value(), body.at("/processing/priority").asInt());
  }

  @Test
  @DisplayName("detailed-status of a finished track has no processing block")
  void detailedStatusAfterCompletion() throws Exception {
    String jobId =
        ApiFixture.json(api.request("POST", "/api/tracks/" + track.id() + "/process-async"))
            .get("jobId")
            .asText();
    assertEquals(JobStatus.COMPLETED, awaitTerminal(jobId).status());

    JsonNode body =
        ApiFixture.json(api.request("GET", "/api/tracks/" + track.id() + "/detailed-status"));

    assertEquals("completed", body.get("status").asText());
    assertEquals(2, body.get("versionCount").asInt());
    assertTrue(body.get("hasExtended").asBoolean());
    assertEquals(16, body.at("/settings/introLength").asInt());
    assertFalse(body.has("processing"));
  }

  @Test
  @DisplayName("detailed-status rejects bad ids and hides other owners' tracks")
  void detailedStatusErrors() throws Exception {
    assertEquals(400, api.request("GET", "/api/tracks/abc/detailed-status").getStatus());
    HttpTester.Response missing = api.request("GET", "/api/tracks/999/detailed-status");
    assertEquals(404, missing.getStatus());
    assertEquals("Track not found", ApiFixture.json(missing).get("message").asText());
    assertEquals(
        404,
        api.request(
                "GET",
                "/api/tracks/" + track.id() + "/detailed-status",
                null,
                Map.of("X-User-Id", "mallory"))
            .getStatus());
    assertEquals(404, api.request("GET", "/api/tracks/" + track.id() + "/history").getStatus());
  }

  @Test
  void outputFilenameUsesNextVersion() {
    TrackRecord t =
        api.tracks.updateStatus(track.id(), TrackUpdate.completed("/r/v1.wav", null))
            .orElseThrow();
    assertEquals("my_mix_extended_v2.wav", TracksServlet.outputFilename(t));
  }

  private JobView awaitTerminal(String jobId) throws Exception {
    long end = System.currentTimeMillis() + 3000;
    while (System.currentTimeMillis() < end) {
      JobView v = api.jobs.getJobStatus(jobId).orElseThrow();
      if (v.status().isTerminal()) return v;
      Thread.sleep(20);
    }
    fail("Timeout waiting for job " + jobId);
    return null; // Unreachable
  }
}
