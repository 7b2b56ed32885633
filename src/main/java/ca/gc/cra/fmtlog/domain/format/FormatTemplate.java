package ca.gc.cra.fmtlog.domain.format;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable, pre-parsed format template.
 * <p><strong>Why:</strong> Parsing once lets configuration-time validation reject malformed templates before
 * they reach the logging hot path.</p>
 * <p><strong>Syntax:</strong> literal text interleaved with {@code {}} (automatic), {@code {0}} (positional)
 * or {@code {name}} (named) placeholders, each optionally followed by {@code :specifier}. Doubled braces
 * produce literal braces. Automatic placeholders cannot be mixed with positional or named ones.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 * @see FormatSpec
 */
public final class FormatTemplate {
  private static final Pattern NAME = Pattern.compile("%?[A-Za-z_][A-Za-z0-9_.]*");
  private static final int MAX_INDEX_DIGITS = 6;

  private final String source;
  private final List<Segment> segments;

  /** A piece of a parsed template. */
  public interface Segment {}

  /**
   * Verbatim text copied to the output.
   *
   * @param text literal characters with brace escapes already resolved
   */
  public record Literal(String text) implements Segment {}

  /** How a placeholder selects its argument. */
  public enum Binding {
    /** {@code {}}: the next argument in sequence. */
    AUTOMATIC,
    /** {@code {3}}: argument by index. */
    POSITIONAL,
    /** {@code {name}}: argument by name. */
    NAMED
  }

  /**
   * A substitution point.
   *
   * @param binding how the argument is selected
   * @param index argument index for automatic and positional placeholders; {@code -1} when named
   * @param name argument name for named placeholders; {@code null} otherwise
   * @param spec parsed specifier
   */
  public record Placeholder(Binding binding, int index, String name, FormatSpec spec) implements Segment {}

  private FormatTemplate(String source, List<Segment> segments) {
    this.source = source;
    this.segments = List.copyOf(segments);
  }

  /**
   * Parses a template.
   *
   * @param source template text; must not be {@code null}
   * @return parsed template
   * @throws FormatException with {@link FormatException.Kind#MALFORMED_SPECIFIER} when braces are unbalanced,
   *     a specifier is invalid, or automatic and explicit placeholders are mixed
   */
  public static FormatTemplate parse(String source) {
    Objects.requireNonNull(source, "template");
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int automatic = 0;
    boolean explicit = false;
    int n = source.length();
    int i = 0;
    while (i < n) {
      char c = source.charAt(i);
      if (c == '{') {
        if (i + 1 < n && source.charAt(i + 1) == '{') {
          literal.append('{');
          i += 2;
          continue;
        }
        int close = source.indexOf('}', i + 1);
        if (close < 0) {
          throw malformed(source, "unterminated placeholder at offset " + i);
        }
        String body = source.substring(i + 1, close);
        if (body.indexOf('{') >= 0) {
          throw malformed(source, "nested '{' at offset " + (i + 1 + body.indexOf('{')));
        }
        if (literal.length() > 0) {
          segments.add(new Literal(literal.toString()));
          literal.setLength(0);
        }
        Placeholder placeholder = parsePlaceholder(source, body, automatic);
        if (placeholder.binding() == Binding.AUTOMATIC) {
          automatic++;
        } else {
          explicit = true;
        }
        if (automatic > 0 && explicit) {
          throw malformed(source, "cannot mix automatic '{}' with positional or named placeholders");
        }
        segments.add(placeholder);
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < n && source.charAt(i + 1) == '}') {
          literal.append('}');
          i += 2;
          continue;
        }
        throw malformed(source, "unmatched '}' at offset " + i);
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) {
      segments.add(new Literal(literal.toString()));
    }
    return new FormatTemplate(source, segments);
  }

  /**
   * Returns the original template text.
   *
   * @return source text
   */
  public String source() {
    return source;
  }

  /**
   * Returns the parsed segments in template order.
   *
   * @return immutable segment list
   */
  public List<Segment> segments() {
    return segments;
  }

  /**
   * Indicates whether the template contains any placeholder.
   *
   * @return {@code true} when at least one placeholder is present
   */
  public boolean hasPlaceholders() {
    for (Segment segment : segments) {
      if (segment instanceof Placeholder) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the names referenced by named placeholders.
   *
   * @return names in first-use order
   */
  public Set<String> placeholderNames() {
    Set<String> names = new LinkedHashSet<>();
    for (Segment segment : segments) {
      if (segment instanceof Placeholder placeholder && placeholder.binding() == Binding.NAMED) {
        names.add(placeholder.name());
      }
    }
    return names;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof FormatTemplate that && source.equals(that.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode();
  }

  @Override
  public String toString() {
    return source;
  }

  private static Placeholder parsePlaceholder(String source, String body, int automaticIndex) {
    int colon = body.indexOf(':');
    String id = colon < 0 ? body : body.substring(0, colon);
    FormatSpec spec = colon < 0 ? FormatSpec.EMPTY : FormatSpec.parse(body.substring(colon + 1));
    if (id.isEmpty()) {
      return new Placeholder(Binding.AUTOMATIC, automaticIndex, null, spec);
    }
    if (isDigits(id)) {
      if (id.length() > MAX_INDEX_DIGITS) {
        throw malformed(source, "argument index too large: " + id);
      }
      return new Placeholder(Binding.POSITIONAL, Integer.parseInt(id), null, spec);
    }
    if (NAME.matcher(id).matches()) {
      return new Placeholder(Binding.NAMED, -1, id, spec);
    }
    throw malformed(source, "invalid argument id '" + id + "'");
  }

  private static boolean isDigits(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static FormatException malformed(String source, String detail) {
    return new FormatException(
        FormatException.Kind.MALFORMED_SPECIFIER, "invalid template '" + source + "': " + detail);
  }
}
