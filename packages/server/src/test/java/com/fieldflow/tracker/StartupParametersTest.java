package com.fieldflow.tracker;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldflow.tracker.exception.ConfigException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNamedValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config=/etc/fieldflow.yaml", "--port=9090", "--dry"});

    assertEquals("/etc/fieldflow.yaml", params.configFile());
    assertEquals(9090, params.getParameter("port", Integer.class));
    assertTrue(params.getParameter("dry", Boolean.class));
    assertEquals("fallback", params.getParameter("missing", String.class, "fallback"));
  }

  @Test
  void noArgumentsMeansBundledConfiguration() {
    StartupParameters params = new StartupParameters(null);

    assertNull(params.configFile());
    assertTrue(params.asMap().isEmpty());
  }

  @Test
  void rejectsPositionalArguments() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"config.yaml"}));
  }

  @Test
  void rejectsMalformedNumbers() {
    StartupParameters params = new StartupParameters(new String[] {"--port=http"});

    assertThrows(ConfigException.class, () -> params.getParameter("port", Integer.class));
  }
}
