package ca.gc.cra.fmtlog.domain.format;

import ca.gc.cra.fmtlog.domain.style.TextStyle;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> One value bound to a template placeholder.
 * <p><strong>Why:</strong> Heterogeneous argument lists are modeled as a tagged union with an explicit
 * {@link ArgumentKind} discriminant, so placeholder resolution never needs reflection.</p>
 * <p><strong>Role:</strong> Domain value built by callers and consumed by the format engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param kind discriminant selecting how {@code value} is interpreted
 * @param value boxed value matching {@code kind} ({@link Long}, {@link Double}, {@link String},
 *     {@link Boolean} or {@link Instant})
 * @param name optional name for {@code {name}} placeholders; {@code null} when unnamed
 * @param style presentation hint wrapped around the rendered text; {@link TextStyle#NONE} when absent
 * @since 0.1.0
 */
public record Argument(ArgumentKind kind, Object value, String name, TextStyle style) {

  /**
   * Validates that {@code value} matches {@code kind}.
   */
  public Argument {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
    Class<?> expected = switch (kind) {
      case INTEGER -> Long.class;
      case FLOAT -> Double.class;
      case STRING -> String.class;
      case BOOLEAN -> Boolean.class;
      case TIMESTAMP -> Instant.class;
    };
    if (!expected.isInstance(value)) {
      throw new IllegalArgumentException(
          kind + " argument requires " + expected.getSimpleName() + " but was " + value.getClass().getSimpleName());
    }
    if (name != null && name.isBlank()) {
      throw new IllegalArgumentException("argument name must not be blank");
    }
    style = style == null ? TextStyle.NONE : style;
  }

  /**
   * Creates an integer argument.
   *
   * @param value integer value
   * @return unnamed argument
   */
  public static Argument of(long value) {
    return new Argument(ArgumentKind.INTEGER, value, null, TextStyle.NONE);
  }

  /**
   * Creates a floating point argument.
   *
   * @param value floating point value
   * @return unnamed argument
   */
  public static Argument of(double value) {
    return new Argument(ArgumentKind.FLOAT, value, null, TextStyle.NONE);
  }

  /**
   * Creates a string argument; {@code null} renders as {@code "null"}.
   *
   * @param value text
   * @return unnamed argument
   */
  public static Argument of(String value) {
    return new Argument(ArgumentKind.STRING, value == null ? "null" : value, null, TextStyle.NONE);
  }

  /**
   * Creates a boolean argument.
   *
   * @param value boolean value
   * @return unnamed argument
   */
  public static Argument of(boolean value) {
    return new Argument(ArgumentKind.BOOLEAN, value, null, TextStyle.NONE);
  }

  /**
   * Creates a timestamp argument.
   *
   * @param value instant; must not be {@code null}
   * @return unnamed argument
   */
  public static Argument of(Instant value) {
    return new Argument(ArgumentKind.TIMESTAMP, Objects.requireNonNull(value, "value"), null, TextStyle.NONE);
  }

  /**
   * Creates a string argument carrying a color or emphasis hint.
   *
   * @param text text to render
   * @param style style wrapped around the rendered text
   * @return unnamed styled argument
   */
  public static Argument styled(String text, TextStyle style) {
    return new Argument(ArgumentKind.STRING, text == null ? "null" : text, null, style);
  }

  /**
   * Binds a name to an argument for {@code {name}} placeholders.
   *
   * @param name placeholder name
   * @param argument argument to bind
   * @return named copy of {@code argument}
   */
  public static Argument named(String name, Argument argument) {
    return argument.withName(name);
  }

  /**
   * Returns a copy carrying the given name.
   *
   * @param newName placeholder name; must not be blank
   * @return named copy
   */
  public Argument withName(String newName) {
    return new Argument(kind, value, Objects.requireNonNull(newName, "name"), style);
  }

  /**
   * Indicates whether this argument answers to a named placeholder.
   *
   * @return {@code true} when a name is bound
   */
  public boolean isNamed() {
    return name != null;
  }
}
