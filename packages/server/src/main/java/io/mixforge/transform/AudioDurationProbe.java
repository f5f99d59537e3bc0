package io.mixforge.transform;

import java.nio.file.Path;
import java.util.Optional;

/** Reads the playing time of an audio file. */
@FunctionalInterface
public interface AudioDurationProbe {

  /** Duration in seconds, or empty when the format is not understood. */
  Optional<Double> durationSeconds(Path file);
}
