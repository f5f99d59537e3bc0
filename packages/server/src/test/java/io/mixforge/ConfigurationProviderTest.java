package io.mixforge;

import static org.junit.jupiter.api.Assertions.*;

import io.mixforge.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  @DisplayName("the bundled application.yaml is used when no file is given")
  void bundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(8080, config.getInt("http.port"));
    assertEquals(3, config.getInt("jobs.max-versions"));
    assertEquals(15, config.getInt("events.heartbeat-seconds"));
  }

  @Test
  void externalFile() throws Exception {
    Path file =
        Files.writeString(
            dir.resolve("custom.yaml"), "http:\n  port: 9191\njobs:\n  max-versions: 5\n");

    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertEquals(9191, config.getInt("http.port"));
    assertEquals(5, config.getInt("jobs.max-versions"));
    assertFalse(config.containsKey("upload.chunk-size"));
  }

  @Test
  void missingFile() {
    String path = dir.resolve("nope.yaml").toString();
    ConfigException ex =
        assertThrows(ConfigException.class, () -> new ConfigurationProvider(path));
    assertEquals("Configuration file not found: " + path, ex.getMessage());
  }

  @Test
  @DisplayName("system properties override the YAML values")
  void systemPropertyWins() {
    System.setProperty("jobs.max-versions", "7");
    try {
      assertEquals(7, new ConfigurationProvider(null).config().getInt("jobs.max-versions"));
    } finally {
      System.clearProperty("jobs.max-versions");
    }
  }
}
