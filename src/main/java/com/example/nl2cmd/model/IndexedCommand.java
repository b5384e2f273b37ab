package com.example.nl2cmd.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Value side of the similarity index: the intent of a known query and the command it maps to
 * for each OS family that provides one.
 */
public final class IndexedCommand {

  private final String intent;
  private final Map<OsFamily, String> commands;

  public IndexedCommand(String intent, Map<OsFamily, String> commands) {
    this.intent = intent;
    this.commands = commands.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(commands));
  }

  public String getIntent() {
    return intent;
  }

  public Map<OsFamily, String> getCommands() {
    return commands;
  }

  public Optional<String> commandFor(OsFamily os) {
    return Optional.ofNullable(commands.get(os));
  }

  @Override
  public String toString() {
    return "IndexedCommand{intent=" + intent + ", commands=" + commands + '}';
  }
}
