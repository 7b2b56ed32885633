package ca.gc.cra.fmtlog.application.logging;

import ca.gc.cra.fmtlog.application.pattern.CompiledPattern;
import ca.gc.cra.fmtlog.application.port.SinkPort;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.domain.log.SourceLocation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Named logger that filters by severity, formats the message body, renders the line
 * pattern, and writes the line to each of its sinks in order.
 * <p><strong>Why:</strong> One call site per message, with formatting paid only for messages that pass the
 * threshold.</p>
 * <p><strong>Role:</strong> Application service created by {@link LoggerRegistry} or by hand.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Short-circuit filtered messages before any formatting work.</li>
 *   <li>Keep writing to the remaining sinks when one fails, reporting failures in a {@link DispatchReport}.</li>
 *   <li>Validate every pattern change before applying it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Log calls snapshot the configuration under the read lock; {@link #setLevel},
 * {@link #setPattern} and {@link #reconfigure} take the write lock. A reconfiguration is visible to every
 * log call that starts after it returns.</p>
 * <p><strong>Observability:</strong> Counts {@value #FILTERED_METRIC}, {@value #DISPATCHED_METRIC} and
 * {@value #SINK_FAILURE_METRIC}.</p>
 *
 * @since 0.1.0
 */
public final class Logger {
  /** Counter for messages dropped by the severity filter. */
  public static final String FILTERED_METRIC = "log.filtered";
  /** Counter for messages rendered and offered to sinks. */
  public static final String DISPATCHED_METRIC = "log.dispatched";
  /** Counter for individual sink write failures. */
  public static final String SINK_FAILURE_METRIC = "sink.write.failed";
  /** Observation of rendered line length in characters. */
  public static final String LINE_LENGTH_METRIC = "log.line.length";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Logger.class);

  private final String name;
  private final LoggerRuntime runtime;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private SeverityLevel threshold;
  private CompiledPattern pattern;
  private List<SinkPort> sinks;

  /**
   * Creates a logger with the default runtime.
   *
   * @param config initial configuration
   * @throws FormatException when the configured pattern is invalid
   */
  public Logger(LoggerConfig config) {
    this(config, LoggerRuntime.defaults());
  }

  /**
   * Creates a logger.
   *
   * @param config initial configuration
   * @param runtime shared collaborators
   * @throws FormatException when the configured pattern is invalid
   */
  public Logger(LoggerConfig config, LoggerRuntime runtime) {
    Objects.requireNonNull(config, "config");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.name = config.name();
    this.threshold = config.threshold();
    this.pattern = runtime.renderer().compile(config.pattern());
    this.sinks = config.sinks();
  }

  public String name() {
    return name;
  }

  /**
   * Logs a message without call-site location.
   *
   * @param level message level; must not be {@link SeverityLevel#OFF}
   * @param template message template; logged verbatim when {@code args} is empty
   * @param args template arguments
   * @return dispatch outcome
   * @throws FormatException when the template or the line cannot be rendered; no sink is written
   */
  public DispatchReport log(SeverityLevel level, String template, Argument... args) {
    return log(level, SourceLocation.UNKNOWN, template, args);
  }

  /**
   * Logs a message.
   *
   * @param level message level; must not be {@link SeverityLevel#OFF}
   * @param source call-site location rendered by {@code {%source}}
   * @param template message template; logged verbatim when {@code args} is empty
   * @param args template arguments
   * @return dispatch outcome
   * @throws FormatException when the template or the line cannot be rendered; no sink is written
   */
  public DispatchReport log(SeverityLevel level, SourceLocation source, String template, Argument... args) {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(template, "template");
    if (level == SeverityLevel.OFF) {
      throw new IllegalArgumentException("OFF is a threshold, not a message level");
    }
    CompiledPattern activePattern;
    List<SinkPort> activeSinks;
    lock.readLock().lock();
    try {
      if (!SeverityLevel.passes(level, threshold)) {
        runtime.metrics().increment(FILTERED_METRIC);
        return DispatchReport.filtered();
      }
      activePattern = pattern;
      activeSinks = sinks;
    } finally {
      lock.readLock().unlock();
    }

    String body = args.length == 0 ? template : runtime.engine().render(template, args);
    RenderedLine line = runtime.renderer().renderLine(
        activePattern, level, name, body, runtime.clock().now(), source);
    runtime.metrics().observe(LINE_LENGTH_METRIC, line.text().length());

    List<SinkFailure> failures = new ArrayList<>(0);
    for (SinkPort sink : activeSinks) {
      try {
        sink.write(line);
      } catch (IOException | RuntimeException ex) {
        failures.add(new SinkFailure(sink.describe(), ex));
        runtime.metrics().increment(SINK_FAILURE_METRIC);
      }
    }
    runtime.metrics().increment(DISPATCHED_METRIC);
    return new DispatchReport(true, activeSinks.size(), failures);
  }

  public DispatchReport trace(String template, Argument... args) {
    return log(SeverityLevel.TRACE, template, args);
  }

  public DispatchReport debug(String template, Argument... args) {
    return log(SeverityLevel.DEBUG, template, args);
  }

  public DispatchReport info(String template, Argument... args) {
    return log(SeverityLevel.INFO, template, args);
  }

  public DispatchReport warn(String template, Argument... args) {
    return log(SeverityLevel.WARN, template, args);
  }

  public DispatchReport error(String template, Argument... args) {
    return log(SeverityLevel.ERROR, template, args);
  }

  public DispatchReport critical(String template, Argument... args) {
    return log(SeverityLevel.CRITICAL, template, args);
  }

  /**
   * Indicates whether a message at {@code level} would be dispatched right now.
   *
   * @param level candidate level
   * @return {@code true} when {@code level} passes the current threshold
   */
  public boolean shouldLog(SeverityLevel level) {
    lock.readLock().lock();
    try {
      return level != SeverityLevel.OFF && SeverityLevel.passes(level, threshold);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Changes the threshold.
   *
   * @param level new threshold; {@link SeverityLevel#OFF} silences the logger
   */
  public void setLevel(SeverityLevel level) {
    Objects.requireNonNull(level, "level");
    lock.writeLock().lock();
    try {
      threshold = level;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Validates and installs a new line pattern.
   *
   * @param newPattern pattern text
   * @throws FormatException when the pattern is invalid; the previous pattern stays active
   */
  public void setPattern(String newPattern) {
    setPattern(runtime.renderer().compile(newPattern));
  }

  /**
   * Installs an already validated line pattern.
   *
   * @param compiled pattern from {@link ca.gc.cra.fmtlog.application.pattern.PatternRenderer#compile(String)}
   */
  public void setPattern(CompiledPattern compiled) {
    Objects.requireNonNull(compiled, "compiled");
    lock.writeLock().lock();
    try {
      pattern = compiled;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Atomically replaces threshold, pattern, and sinks.
   *
   * @param config new configuration; its name must equal {@link #name()}
   * @throws IllegalArgumentException when the name differs
   * @throws FormatException when the pattern is invalid; nothing changes
   */
  public void reconfigure(LoggerConfig config) {
    Objects.requireNonNull(config, "config");
    if (!name.equals(config.name())) {
      throw new IllegalArgumentException("cannot rename logger " + name + " to " + config.name());
    }
    CompiledPattern compiled = runtime.renderer().compile(config.pattern());
    lock.writeLock().lock();
    try {
      threshold = config.threshold();
      pattern = compiled;
      sinks = config.sinks();
    } finally {
      lock.writeLock().unlock();
    }
    log.debug("Reconfigured logger {} at {} with {} sink(s)", name, config.threshold(), config.sinks().size());
  }

  /**
   * Flushes every sink, continuing past failures.
   *
   * @return sinks that failed to flush
   */
  public List<SinkFailure> flush() {
    List<SinkFailure> failures = new ArrayList<>(0);
    for (SinkPort sink : sinks()) {
      try {
        sink.flush();
      } catch (IOException | RuntimeException ex) {
        failures.add(new SinkFailure(sink.describe(), ex));
      }
    }
    return failures;
  }

  public SeverityLevel level() {
    lock.readLock().lock();
    try {
      return threshold;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the active pattern text.
   *
   * @return pattern source
   */
  public String pattern() {
    lock.readLock().lock();
    try {
      return pattern.source();
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<SinkPort> sinks() {
    lock.readLock().lock();
    try {
      return sinks;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns a snapshot of the current configuration.
   *
   * @return configuration equivalent to the active state
   */
  public LoggerConfig config() {
    lock.readLock().lock();
    try {
      return new LoggerConfig(name, threshold, pattern.source(), sinks);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    return "Logger[" + name + "]";
  }
}
