package com.fieldflow.tracker;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldflow.tracker.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsBundledConfiguration() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(1000L, config.getLong("polling.interval-ms"));
    assertEquals(120_000L, config.getLong("heuristics.inactivity-limit-ms"));
    assertFalse(config.getBoolean("heuristics.hard-cap.respect-activity"));
    assertEquals("file", config.getString("store.type"));
    assertTrue(config.getList(String.class, "heuristics.activity-markers").contains("filling"));
  }

  @Test
  void explicitFileWins(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("tracker.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "polling:",
            "  interval-ms: 250",
            "store:",
            "  type: memory",
            "heuristics:",
            "  activity-markers:",
            "    - uploading"));

    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertEquals(250L, config.getLong("polling.interval-ms"));
    assertEquals("memory", config.getString("store.type"));
    assertEquals(List.of("uploading"), config.getList(String.class, "heuristics.activity-markers"));
    assertFalse(config.containsKey("http.port"));
  }

  @Test
  void missingFileFails(@TempDir Path dir) {
    String missing = dir.resolve("absent.yaml").toString();

    assertThrows(ConfigException.class, () -> new ConfigurationProvider(missing));
  }
}
