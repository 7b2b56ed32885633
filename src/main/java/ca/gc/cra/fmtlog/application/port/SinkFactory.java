package ca.gc.cra.fmtlog.application.port;

/**
 * Port resolving built-in sink kinds to sink instances.
 *
 * <p>Implementations return the same instance for repeated requests of one kind so loggers writing to the
 * same stream share its serialization.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SinkFactory {
  /**
   * Returns the sink for {@code kind}.
   *
   * @param kind requested destination
   * @return sink instance
   */
  SinkPort sink(SinkKind kind);
}
