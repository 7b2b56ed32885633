package ca.gc.cra.fmtlog.application.logging;

import ca.gc.cra.fmtlog.application.pattern.CompiledPattern;
import ca.gc.cra.fmtlog.application.pattern.PatternRenderer;
import ca.gc.cra.fmtlog.application.port.SinkFactory;
import ca.gc.cra.fmtlog.application.port.SinkKind;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Name-keyed collection of loggers with a lazily created default logger.
 * <p><strong>Why:</strong> Lets distant call sites share one configured logger by name, and lets
 * configuration change a logger without invalidating references already handed out.</p>
 * <p><strong>Role:</strong> Application service; the process-wide instance lives in
 * {@link ca.gc.cra.fmtlog.config.DefaultRegistry}, tests create their own.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the default logger exactly once, even under concurrent first use.</li>
 *   <li>Reconfigure existing loggers in place so a {@link #lookup(String)} result stays valid.</li>
 *   <li>Apply level and pattern changes across every registered logger.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The name map is guarded by a read/write lock; loggers guard their own
 * configuration.</p>
 *
 * @since 0.1.0
 */
public final class LoggerRegistry {
  /** Name of the lazily created default logger. */
  public static final String DEFAULT_LOGGER_NAME = "default";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggerRegistry.class);

  private final LoggerRuntime runtime;
  private final SinkFactory sinkFactory;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Logger> loggers = new LinkedHashMap<>();
  private Logger defaultLogger;

  /**
   * Creates an empty registry.
   *
   * @param runtime collaborators shared by the loggers this registry creates
   * @param sinkFactory resolves the sinks of the default and color console loggers
   */
  public LoggerRegistry(LoggerRuntime runtime, SinkFactory sinkFactory) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
  }

  /**
   * Returns the default logger, creating it on first use with name {@value #DEFAULT_LOGGER_NAME}, threshold
   * INFO, the default pattern, and a plain stdout sink. Concurrent first callers all receive the same
   * instance.
   *
   * @return default logger
   */
  public Logger getOrCreateDefault() {
    lock.readLock().lock();
    try {
      if (defaultLogger != null) {
        return defaultLogger;
      }
    } finally {
      lock.readLock().unlock();
    }
    lock.writeLock().lock();
    try {
      if (defaultLogger == null) {
        Logger existing = loggers.get(DEFAULT_LOGGER_NAME);
        defaultLogger = existing != null
            ? existing
            : new Logger(LoggerConfig.of(DEFAULT_LOGGER_NAME, sinkFactory.sink(SinkKind.STDOUT)), runtime);
        loggers.put(DEFAULT_LOGGER_NAME, defaultLogger);
        log.debug("Created default logger");
      }
      return defaultLogger;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Replaces the default logger and registers it under its own name.
   *
   * @param logger new default
   */
  public void setDefault(Logger logger) {
    Objects.requireNonNull(logger, "logger");
    lock.writeLock().lock();
    try {
      loggers.put(logger.name(), logger);
      defaultLogger = logger;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Registers or reconfigures a logger, keeping the identity of an existing one.
   *
   * @param config logger configuration
   * @return registered logger
   * @throws FormatException when the pattern is invalid; the registry is unchanged
   */
  public Logger register(LoggerConfig config) {
    return register(config, RegistrationMode.REPLACE);
  }

  /**
   * Registers a logger.
   *
   * @param config logger configuration
   * @param mode behavior when the name is taken
   * @return registered logger; the existing instance when reconfigured
   * @throws DuplicateLoggerException in {@link RegistrationMode#STRICT} mode when the name is taken
   * @throws FormatException when the pattern is invalid; the registry is unchanged
   */
  public Logger register(LoggerConfig config, RegistrationMode mode) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(mode, "mode");
    lock.writeLock().lock();
    try {
      Logger existing = loggers.get(config.name());
      if (existing != null) {
        if (mode == RegistrationMode.STRICT) {
          throw new DuplicateLoggerException(config.name());
        }
        existing.reconfigure(config);
        return existing;
      }
      Logger created = new Logger(config, runtime);
      loggers.put(created.name(), created);
      log.debug("Registered logger {} at {}", created.name(), config.threshold());
      return created;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Adds an explicitly constructed logger; the caller keeps its reference.
   *
   * @param logger logger to share
   * @return {@code logger}
   * @throws DuplicateLoggerException when another instance already holds the name
   */
  public Logger register(Logger logger) {
    Objects.requireNonNull(logger, "logger");
    lock.writeLock().lock();
    try {
      Logger existing = loggers.get(logger.name());
      if (existing != null && existing != logger) {
        throw new DuplicateLoggerException(logger.name());
      }
      loggers.put(logger.name(), logger);
      return logger;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Registers a logger writing to the color stdout sink; fails when the name is taken.
   *
   * @param name logger name
   * @return new logger
   * @throws DuplicateLoggerException when the name is taken
   */
  public Logger colorConsole(String name) {
    return register(LoggerConfig.of(name, sinkFactory.sink(SinkKind.STDOUT_COLOR)), RegistrationMode.STRICT);
  }

  /**
   * Returns the logger registered under {@code name}.
   *
   * @param name logger name
   * @return logger
   * @throws LoggerNotFoundException when no logger has that name
   */
  public Logger lookup(String name) {
    return find(name).orElseThrow(() -> new LoggerNotFoundException(name));
  }

  public Optional<Logger> find(String name) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(loggers.get(name));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Removes a logger. References already handed out keep working.
   *
   * @param name logger name
   * @return {@code true} when a logger was removed
   */
  public boolean drop(String name) {
    lock.writeLock().lock();
    try {
      Logger removed = loggers.remove(name);
      if (removed != null && removed == defaultLogger) {
        defaultLogger = null;
      }
      return removed != null;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Sets the threshold of every registered logger.
   *
   * @param level new threshold
   */
  public void setLevel(SeverityLevel level) {
    Objects.requireNonNull(level, "level");
    for (Logger logger : snapshot()) {
      logger.setLevel(level);
    }
  }

  /**
   * Validates a pattern once and installs it on every registered logger.
   *
   * @param pattern pattern text
   * @throws FormatException when the pattern is invalid; no logger changes
   */
  public void setPattern(String pattern) {
    CompiledPattern compiled = runtime.renderer().compile(pattern);
    for (Logger logger : snapshot()) {
      logger.setPattern(compiled);
    }
  }

  /**
   * Flushes every registered logger.
   *
   * @return sinks that failed to flush
   */
  public List<SinkFailure> flushAll() {
    List<SinkFailure> failures = new ArrayList<>(0);
    for (Logger logger : snapshot()) {
      failures.addAll(logger.flush());
    }
    return failures;
  }

  /**
   * Returns registered names in registration order.
   *
   * @return name snapshot
   */
  public List<String> names() {
    lock.readLock().lock();
    try {
      return List.copyOf(loggers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the pattern renderer shared by this registry's loggers.
   *
   * @return renderer
   */
  public PatternRenderer renderer() {
    return runtime.renderer();
  }

  private List<Logger> snapshot() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(loggers.values());
    } finally {
      lock.readLock().unlock();
    }
  }
}
