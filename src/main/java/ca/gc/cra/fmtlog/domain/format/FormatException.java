package ca.gc.cra.fmtlog.domain.format;

import java.util.Objects;

/**
 * Unchecked failure raised when a template cannot be parsed or rendered against its arguments.
 *
 * <p>A malformed log call is a programming defect, so the exception always reaches the immediate caller of
 * the failing render step. Rendering is all-or-nothing: no partial output accompanies the exception.</p>
 *
 * @since 0.1.0
 */
public final class FormatException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure categories reported by the format engine. */
  public enum Kind {
    /** A named placeholder has no argument carrying that name. */
    UNRESOLVED_PLACEHOLDER,
    /** The specifier does not apply to the argument's kind (e.g. {@code {:x}} on a string). */
    TYPE_MISMATCH,
    /** The template or one of its specifiers is syntactically invalid. */
    MALFORMED_SPECIFIER,
    /** A positional or implicit placeholder points past the end of the argument list. */
    ARGUMENT_INDEX_OUT_OF_RANGE
  }

  private final Kind kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable detail
   */
  public FormatException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception of the given kind wrapping a lower-level cause.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable detail
   * @param cause underlying failure
   */
  public FormatException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return kind of failure
   */
  public Kind kind() {
    return kind;
  }
}
