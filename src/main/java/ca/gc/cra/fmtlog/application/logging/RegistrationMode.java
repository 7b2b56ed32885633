package ca.gc.cra.fmtlog.application.logging;

/**
 * Behavior of {@link LoggerRegistry#register(LoggerConfig, RegistrationMode)} when the name is taken.
 *
 * @since 0.1.0
 */
public enum RegistrationMode {
  /** Reconfigure the existing logger in place, keeping its identity. */
  REPLACE,
  /** Fail with {@link DuplicateLoggerException}. */
  STRICT
}
