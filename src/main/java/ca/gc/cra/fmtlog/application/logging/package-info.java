/**
 * <strong>Purpose:</strong> Loggers and the registry that names them.
 * <p><strong>Pipeline:</strong> severity filter, message formatting, line rendering, then each sink in
 * order.</p>
 * <p><strong>Concurrency:</strong> Logger configuration and the registry map are each guarded by a
 * {@link java.util.concurrent.locks.ReentrantReadWriteLock}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.application.logging;
