package com.fieldflow.tracker.polling;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldflow.tracker.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class PollingSettingsTest {

  @Test
  void emptyConfigurationYieldsDefaults() {
    assertEquals(
        PollingSettings.defaults(), PollingSettings.fromConfiguration(new BaseConfiguration()));
  }

  @Test
  void overridesAreReadInMilliseconds() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("polling.interval-ms", 500);
    config.setProperty("heuristics.inactivity-limit-ms", 60_000);
    config.setProperty("heuristics.hard-cap.respect-activity", true);

    PollingSettings settings = PollingSettings.fromConfiguration(config);

    assertEquals(Duration.ofMillis(500), settings.interval());
    assertEquals(Duration.ofMinutes(1), settings.inactivityLimit());
    assertTrue(settings.hardCapRespectsActivity());
    assertEquals(Duration.ofMinutes(5), settings.hardCap());
  }

  @Test
  void nonPositiveDurationsAreRejected() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("heuristics.hard-cap-ms", 0);

    ConfigException e =
        assertThrows(ConfigException.class, () -> PollingSettings.fromConfiguration(config));
    assertTrue(e.getMessage().contains("heuristics.hard-cap-ms"));
  }

  @Test
  void unparsableValuesAreRejected() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("polling.interval-ms", "soon");

    assertThrows(ConfigException.class, () -> PollingSettings.fromConfiguration(config));
  }
}
