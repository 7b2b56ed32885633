package ca.gc.cra.fmtlog.application.logging;

/**
 * Raised by {@link LoggerRegistry#lookup(String)} for an unknown name.
 *
 * @since 0.1.0
 */
public final class LoggerNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String loggerName;

  public LoggerNotFoundException(String loggerName) {
    super("no logger named " + loggerName);
    this.loggerName = loggerName;
  }

  public String loggerName() {
    return loggerName;
  }
}
