package io.mixforge.upload;

import static org.junit.jupiter.api.Assertions.*;

import io.mixforge.exception.ConfigException;
import java.util.Set;
import org.junit.jupiter.api.Test;

class UploadLimitsTest {

  @Test
  void normalizesExtensions() {
    UploadLimits limits = new UploadLimits(10, 1, Set.of("WAV", ".Flac"));
    assertEquals(Set.of(".wav", ".flac"), limits.allowedExtensions());
  }

  @Test
  void rejectsNonsense() {
    assertThrows(ConfigException.class, () -> new UploadLimits(0, 1, Set.of(".wav")));
    assertThrows(ConfigException.class, () -> new UploadLimits(10, 0, Set.of(".wav")));
    assertThrows(ConfigException.class, () -> new UploadLimits(10, 1, Set.of()));
  }

  @Test
  void defaultsAcceptCommonAudioFormats() {
    UploadLimits limits = UploadLimits.defaults();
    assertEquals(500L * 1024 * 1024, limits.maxBytes());
    assertTrue(limits.allowedExtensions().containsAll(Set.of(".mp3", ".wav", ".flac", ".ogg")));
  }
}
