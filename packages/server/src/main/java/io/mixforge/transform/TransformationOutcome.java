package io.mixforge.transform;

import java.nio.file.Path;

/**
 * Result reported by a successful transformation. {@code durationSeconds} is null when the
 * executor does not know the duration of what it produced.
 */
public record TransformationOutcome(Path outputPath, Double durationSeconds) {}
