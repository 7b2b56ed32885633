package ca.gc.cra.fmtlog.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers supplied through code, configuration files, or
 * the CLI.
 * <p><strong>Why:</strong> Logger names end up in rendered lines and in the registry key space; they must be
 * printable and stable.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern LOGGER_NAME = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a logger name: letters, digits, dot, underscore, or hyphen.
   *
   * @param loggerName candidate name
   * @return trimmed name
   * @throws NullPointerException if {@code loggerName} is {@code null}
   * @throws IllegalArgumentException if the name is blank or uses other characters
   */
  public static String sanitizeLoggerName(String loggerName) {
    String sanitized = requireNonBlank("logger name", loggerName);
    if (!LOGGER_NAME.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message("logger name",
          "must only contain letters, digits, dot, underscore, or hyphen: '" + sanitized + "'"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
