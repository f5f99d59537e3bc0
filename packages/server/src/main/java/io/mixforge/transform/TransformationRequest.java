package io.mixforge.transform;

import io.mixforge.track.ProcessingSettings;
import java.nio.file.Path;

/** Input handed to a {@link TransformationExecutor}. Both paths are already validated. */
public record TransformationRequest(
    String jobId, Path inputPath, Path outputPath, ProcessingSettings settings) {}
