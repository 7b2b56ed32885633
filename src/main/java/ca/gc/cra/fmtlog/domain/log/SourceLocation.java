package ca.gc.cra.fmtlog.domain.log;

import java.util.Objects;

/**
 * Call-site location passed explicitly with a logging call and rendered through the {@code {%source}}
 * pattern placeholder.
 *
 * @param file source file name, e.g. {@code Main.java}
 * @param line line number; {@code 0} or negative when unknown
 * @param function enclosing method name; may be empty
 * @since 0.1.0
 */
public record SourceLocation(String file, int line, String function) {

  /** Location used when the caller supplied none. */
  public static final SourceLocation UNKNOWN = new SourceLocation("", 0, "");

  /**
   * Normalizes {@code null} components to empty strings.
   */
  public SourceLocation {
    file = Objects.requireNonNullElse(file, "");
    function = Objects.requireNonNullElse(function, "");
  }

  /**
   * Captures the location of the method that called this factory.
   *
   * <p>Uses {@link StackWalker}; callers on hot paths should prefer the canonical constructor.</p>
   *
   * @return location of the caller
   */
  public static SourceLocation here() {
    return StackWalker.getInstance()
        .walk(frames -> frames.skip(1).findFirst())
        .map(frame -> new SourceLocation(
            Objects.requireNonNullElse(frame.getFileName(), frame.getClassName()),
            frame.getLineNumber(),
            frame.getMethodName()))
        .orElse(UNKNOWN);
  }

  /**
   * Indicates whether this location carries any information.
   *
   * @return {@code true} when the file name is empty
   */
  public boolean isUnknown() {
    return file.isEmpty();
  }

  /**
   * Renders as {@code file:line function}, omitting missing parts.
   *
   * @return compact location text; empty for {@link #UNKNOWN}
   */
  public String render() {
    if (isUnknown()) {
      return "";
    }
    StringBuilder out = new StringBuilder(file);
    if (line > 0) {
      out.append(':').append(line);
    }
    if (!function.isEmpty()) {
      out.append(' ').append(function);
    }
    return out.toString();
  }
}
