package com.example.nl2cmd.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Two-valued operating-system family threaded through every strategy call.
 */
public enum OsFamily {
  WINDOWS("windows", "\\"),
  LINUX("linux", "/");

  private final String key;
  private final String pathSeparator;

  OsFamily(String key, String pathSeparator) {
    this.key = key;
    this.pathSeparator = pathSeparator;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public String pathSeparator() {
    return pathSeparator;
  }

  /** Maps a host platform identifier such as the {@code os.name} property. */
  public static OsFamily fromPlatform(String osName) {
    if (osName != null && osName.toLowerCase(Locale.ROOT).contains("win")) {
      return WINDOWS;
    }
    return LINUX;
  }

  @JsonCreator
  public static OsFamily fromKey(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("OS family must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OsFamily family : values()) {
      if (family.key.equals(normalized)) {
        return family;
      }
    }
    throw new IllegalArgumentException("Unknown OS family: " + value);
  }
}
