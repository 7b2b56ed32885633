package ca.gc.cra.fmtlog.application.port;

import java.util.Locale;

/**
 * Built-in sink destinations selectable from configuration.
 *
 * @since 0.1.0
 */
public enum SinkKind {
  STDOUT("stdout"),
  STDERR("stderr"),
  STDOUT_COLOR("stdout_color"),
  STDERR_COLOR("stderr_color");

  private final String id;

  SinkKind(String id) {
    this.id = id;
  }

  /**
   * Returns the configuration identifier.
   *
   * @return identifier such as {@code stdout_color}
   */
  public String id() {
    return id;
  }

  /**
   * Resolves a configuration identifier.
   *
   * @param raw identifier, case-insensitive
   * @return matching kind
   * @throws IllegalArgumentException when no sink kind matches
   */
  public static SinkKind fromId(String raw) {
    String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    for (SinkKind kind : values()) {
      if (kind.id.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown sink: " + raw);
  }
}
