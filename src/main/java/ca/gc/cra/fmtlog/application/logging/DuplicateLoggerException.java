package ca.gc.cra.fmtlog.application.logging;

/**
 * Raised when a strict registration targets a name already present in the registry.
 *
 * @since 0.1.0
 */
public final class DuplicateLoggerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String loggerName;

  public DuplicateLoggerException(String loggerName) {
    super("logger already registered: " + loggerName);
    this.loggerName = loggerName;
  }

  public String loggerName() {
    return loggerName;
  }
}
