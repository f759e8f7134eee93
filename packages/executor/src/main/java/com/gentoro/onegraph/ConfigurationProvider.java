package com.gentoro.onegraph;

import com.gentoro.onegraph.exception.ConfigurationException;
import java.io.File;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.io.FileHandler;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads the YAML application configuration, from an explicit file or from {@code
 * application.yaml} on the classpath.
 *
 * <p>Values may reference environment variables with {@code ${env:NAME}}.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";
  public static final String SERVICES_PREFIX = "services";

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String configFile) {
    this.configuration = new YAMLConfiguration();
    FileHandler handler = new FileHandler(configuration);
    try {
      if (StringUtils.isBlank(configFile)) {
        try (InputStream in =
            ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
          if (in == null) {
            throw new ConfigurationException(
                "No configuration file given and no " + DEFAULT_RESOURCE + " on the classpath");
          }
          handler.load(in);
        }
        log.debug("Loaded configuration from classpath {}", DEFAULT_RESOURCE);
      } else {
        File file = new File(configFile);
        if (!file.isFile()) {
          throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        handler.load(file);
        log.debug("Loaded configuration from {}", file.getAbsolutePath());
      }
    } catch (org.apache.commons.configuration2.ex.ConfigurationException
        | java.io.IOException e) {
      throw new ConfigurationException("Failed to load configuration: " + e.getMessage(), e);
    }
  }

  public Configuration config() {
    return configuration;
  }

  /** Service names mapped to their URLs, from the {@code services} section, in file order. */
  public Map<String, String> services() {
    Map<String, String> services = new LinkedHashMap<>();
    Iterator<String> keys = configuration.getKeys(SERVICES_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= SERVICES_PREFIX.length() + 1) {
        continue;
      }
      String name = key.substring(SERVICES_PREFIX.length() + 1);
      String url = configuration.getString(key);
      if (StringUtils.isBlank(url)) {
        throw new ConfigurationException("Service '" + name + "' has no URL");
      }
      services.put(name, url.trim());
    }
    return services;
  }
}
