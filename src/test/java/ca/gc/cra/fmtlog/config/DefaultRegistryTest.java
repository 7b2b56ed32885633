package ca.gc.cra.fmtlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.fmtlog.application.logging.LoggerRegistry;
import org.junit.jupiter.api.Test;

class DefaultRegistryTest {

  @Test
  void globalRegistryIsASingleton() {
    assertSame(DefaultRegistry.global(), DefaultRegistry.global());
  }

  @Test
  void defaultLoggerComesFromTheGlobalRegistry() {
    assertSame(DefaultRegistry.global().getOrCreateDefault(), DefaultRegistry.defaultLogger());
    assertEquals(LoggerRegistry.DEFAULT_LOGGER_NAME, DefaultRegistry.defaultLogger().name());
  }
}
