package io.mixforge.transform;

import io.mixforge.logging.LoggingService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;

/**
 * {@link AudioDurationProbe} backed by {@code javax.sound.sampled}. The JDK reads WAV, AIFF and AU
 * headers; other formats yield an empty result unless an extra service provider is installed.
 */
public final class SampledAudioDurationProbe implements AudioDurationProbe {
  private static final Logger log = LoggingService.getLogger(SampledAudioDurationProbe.class);

  @Override
  public Optional<Double> durationSeconds(Path file) {
    try {
      AudioFileFormat format = AudioSystem.getAudioFileFormat(file.toFile());
      Object micros = format.properties().get("duration");
      if (micros instanceof Long us) {
        return Optional.of(us / 1_000_000.0);
      }
      long frames = format.getFrameLength();
      float rate = format.getFormat().getFrameRate();
      if (frames == AudioSystem.NOT_SPECIFIED || rate <= 0) {
        return Optional.empty();
      }
      return Optional.of(frames / (double) rate);
    } catch (UnsupportedAudioFileException | IOException e) {
      log.debug("Cannot read duration of {}: {}", file, e.toString());
      return Optional.empty();
    }
  }
}
