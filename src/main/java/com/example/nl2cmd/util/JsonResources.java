package com.example.nl2cmd.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads startup JSON resources from the classpath or the file system.
 */
public final class JsonResources {

  public static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JsonResources() {}

  /**
   * Reads {@code location} into {@code type}. An absent resource yields empty; a malformed one
   * raises {@link IOException}.
   */
  public static <T> Optional<T> read(ResourceLoader loader, String location, Class<T> type) throws IOException {
    try (InputStream in = open(loader, location)) {
      if (in == null) {
        return Optional.empty();
      }
      return Optional.ofNullable(MAPPER.readValue(in, type));
    }
  }

  static InputStream open(ResourceLoader loader, String location) throws IOException {
    if (location == null || location.isBlank()) {
      return null;
    }

    if (location.startsWith("classpath:")) {
      Resource resource = loader.getResource(location);
      return resource.exists() ? resource.getInputStream() : null;
    }

    File file = new File(location);
    if (file.exists() && file.isFile()) {
      return new FileInputStream(file);
    }

    Resource resource = loader.getResource(location);
    return resource.exists() ? resource.getInputStream() : null;
  }
}
