package ca.gc.cra.fmtlog.domain.format;

/**
 * Discriminant of {@link Argument} values.
 *
 * @since 0.1.0
 */
public enum ArgumentKind {
  /** Signed 64-bit integer. */
  INTEGER,
  /** Double-precision floating point value. */
  FLOAT,
  /** Text. */
  STRING,
  /** {@code true} or {@code false}. */
  BOOLEAN,
  /** Point on the time line, rendered in the engine's time zone. */
  TIMESTAMP
}
