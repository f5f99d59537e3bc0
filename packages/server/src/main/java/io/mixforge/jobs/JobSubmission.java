package io.mixforge.jobs;

import io.mixforge.track.ProcessingSettings;
import java.util.Objects;

/**
 * Everything needed to create a job. Paths are raw caller input; they are validated by {@link
 * JobRegistry#submit}. A null {@code jobId} asks the registry to generate one.
 */
public record JobSubmission(
    String jobId,
    long entityId,
    String ownerId,
    String inputPath,
    String outputPath,
    ProcessingSettings settings,
    JobPriority priority) {

  public JobSubmission {
    Objects.requireNonNull(ownerId, "ownerId");
    if (settings == null) settings = ProcessingSettings.defaults();
    if (priority == null) priority = JobPriority.NORMAL;
  }
}
