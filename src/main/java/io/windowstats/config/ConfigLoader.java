package io.windowstats.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.windowstats.util.JsonUtil;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads and validates {@link MonitorConfig} JSON. */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  public static MonitorConfig fromJson(String json) throws JsonProcessingException {
    return validated(JsonUtil.read(json, MonitorConfig.class));
  }

  public static MonitorConfig fromPath(Path path) throws IOException {
    log.debug("Loading monitor configuration from {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return validated(JsonUtil.read(in, MonitorConfig.class));
    }
  }

  public static MonitorConfig fromClasspath(String resource) throws IOException {
    log.debug("Loading monitor configuration from classpath:{}", resource);
    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new FileNotFoundException("Classpath resource not found: " + resource);
      }
      return validated(JsonUtil.read(in, MonitorConfig.class));
    }
  }

  private static MonitorConfig validated(MonitorConfig config) {
    config.validate();
    log.debug("Loaded configuration for {} stats", config.getStats().size());
    return config;
  }
}
