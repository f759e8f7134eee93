package com.gentoro.onegraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onegraph.exception.ConfigurationException;
import com.gentoro.onegraph.service.OkHttpFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ConfigurationProviderTest {

  static String testConfigFile() throws Exception {
    return Path.of(
            ConfigurationProviderTest.class.getClassLoader().getResource("onegraph-test.yaml").toURI())
        .toString();
  }

  @Test
  void loadsServicesInFileOrder() throws Exception {
    ConfigurationProvider provider = new ConfigurationProvider(testConfigFile());

    Map<String, String> services = provider.services();
    assertEquals(List.of("accounts", "reviews"), List.copyOf(services.keySet()));
    assertEquals("http://localhost:4001/graphql", services.get("accounts"));
    assertEquals(3, provider.config().getInt(OkHttpFactory.CONNECT_TIMEOUT_KEY));
    assertEquals(7, provider.config().getInt(OkHttpFactory.READ_TIMEOUT_KEY));
    assertFalse(provider.config().getBoolean("execution.enable-variable-deduplication"));
  }

  @Test
  void fallsBackToBundledConfiguration() {
    ConfigurationProvider provider = new ConfigurationProvider(null);
    assertTrue(provider.config().getBoolean("execution.enable-variable-deduplication"));
    assertTrue(provider.services().isEmpty());
  }

  @Test
  void missingFileFails() {
    assertThrows(
        ConfigurationException.class, () -> new ConfigurationProvider("/does/not/exist.yaml"));
  }

  @Test
  void serviceWithoutUrlFails(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "services:\n  accounts: \"   \"\n");
    ConfigurationProvider provider = new ConfigurationProvider(file.toString());
    assertThrows(ConfigurationException.class, provider::services);
  }
}
