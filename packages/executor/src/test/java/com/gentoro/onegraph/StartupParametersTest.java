package com.gentoro.onegraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onegraph.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

public class StartupParametersTest {

  @Test
  void parsesSeparateAndInlineValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config", "app.yaml", "--plan=plan.json", "--verbose", "--port", "9"});

    assertEquals("app.yaml", params.configFile());
    assertEquals("plan.json", params.getParameter("plan", String.class));
    assertTrue(params.getParameter("verbose", Boolean.class));
    assertEquals(9, params.getParameter("port", Integer.class));
    assertEquals(9L, params.getParameter("port", Long.class));
    assertNull(params.getParameter("variables", String.class));
    assertFalse(params.hasParameter("variables"));
    assertEquals(4, params.asMap().size());
  }

  @Test
  void noArgumentsMeansBundledConfig() {
    assertNull(new StartupParameters(new String[0]).configFile());
    assertNull(new StartupParameters(null).configFile());
  }

  @Test
  void rejectsBadInput() {
    assertThrows(
        ConfigurationException.class, () -> new StartupParameters(new String[] {"plan.json"}));
    assertThrows(ConfigurationException.class, () -> new StartupParameters(new String[] {"--"}));

    StartupParameters params = new StartupParameters(new String[] {"--port", "abc"});
    assertThrows(ConfigurationException.class, () -> params.getParameter("port", Integer.class));
    assertThrows(IllegalArgumentException.class, () -> params.getParameter("port", Double.class));
  }
}
