package ca.gc.cra.fmtlog.infrastructure.terminal;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Decides whether the process writes to a terminal that understands ANSI escape sequences: an interactive
 * console is attached, {@code TERM} is not {@code dumb}, and {@code NO_COLOR} is unset.
 *
 * @since 0.1.0
 */
public final class TerminalColorDetector {
  private final Function<String, String> environment;
  private final BooleanSupplier consoleAttached;

  /**
   * Creates a detector over explicit probes.
   *
   * @param environment environment variable lookup
   * @param consoleAttached whether an interactive console is attached
   */
  public TerminalColorDetector(Function<String, String> environment, BooleanSupplier consoleAttached) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.consoleAttached = Objects.requireNonNull(consoleAttached, "consoleAttached");
  }

  /**
   * Returns a detector over the real process environment and {@link System#console()}.
   *
   * @return system detector
   */
  public static TerminalColorDetector system() {
    return new TerminalColorDetector(System::getenv, () -> System.console() != null);
  }

  /**
   * Probes the terminal.
   *
   * @return {@code true} when color output is appropriate
   */
  public boolean supportsColor() {
    String noColor = environment.apply("NO_COLOR");
    if (noColor != null && !noColor.isEmpty()) {
      return false;
    }
    if ("dumb".equalsIgnoreCase(environment.apply("TERM"))) {
      return false;
    }
    return consoleAttached.getAsBoolean();
  }
}
