package ca.gc.cra.fmtlog.config;

import ca.gc.cra.fmtlog.application.logging.Logger;
import ca.gc.cra.fmtlog.application.logging.LoggerRegistry;
import ca.gc.cra.fmtlog.application.logging.LoggerRuntime;
import ca.gc.cra.fmtlog.infrastructure.sink.ConsoleSinkFactory;
import ca.gc.cra.fmtlog.infrastructure.terminal.ColorMode;
import ca.gc.cra.fmtlog.infrastructure.terminal.TerminalColorDetector;

/**
 * Process-wide registry created on first use.
 *
 * <p>Code that can receive a {@link LoggerRegistry} should take one explicitly; this holder serves call
 * sites without an injection path.</p>
 *
 * @since 0.1.0
 */
public final class DefaultRegistry {

  private DefaultRegistry() {
    // Utility
  }

  /**
   * Returns the process-wide registry, initializing it once.
   *
   * @return global registry over the console with automatic color detection
   */
  public static LoggerRegistry global() {
    return Holder.INSTANCE;
  }

  /**
   * Shortcut for {@code global().getOrCreateDefault()}.
   *
   * @return default logger of the global registry
   */
  public static Logger defaultLogger() {
    return Holder.INSTANCE.getOrCreateDefault();
  }

  private static final class Holder {
    private static final LoggerRegistry INSTANCE = new LoggerRegistry(
        LoggerRuntime.defaults(),
        new ConsoleSinkFactory(ColorMode.AUTO.enabled(TerminalColorDetector.system())));
  }
}
