package ca.gc.cra.fmtlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.fmtlog.config.FacilityConfig;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigCliUtilsTest {
  @TempDir Path tempDir;

  @Test
  void extractConfigPathRemovesEntry() {
    Map<String, String> args = new HashMap<>(Map.of("config", " conf.yaml ", "delayMs", "1"));

    assertEquals("conf.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(new HashMap<>()));
    assertNull(ConfigCliUtils.extractConfigPath(null));
  }

  @Test
  void loadConfigDefaultsWithoutPath() throws IOException {
    assertEquals(FacilityConfig.defaults(), ConfigCliUtils.loadConfig(null));
  }

  @Test
  void loadConfigReadsYaml() throws IOException {
    Path file = tempDir.resolve("fmtlog.yaml");
    Files.writeString(file, """
        defaults:
          level: warn
        """);

    assertEquals(SeverityLevel.WARN, ConfigCliUtils.loadConfig(file.toString()).defaultLevel());
  }

  @Test
  void loadConfigRejectsMissingFile() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigCliUtils.loadConfig(tempDir.resolve("absent.yaml").toString()));
  }

  @Test
  void parseLongValidatesValues() {
    Map<String, String> args = Map.of("n", "12", "blank", " ", "neg", "-3", "text", "x");

    assertEquals(12, ConfigCliUtils.parseLong(args, "n", 5));
    assertEquals(5, ConfigCliUtils.parseLong(args, "blank", 5));
    assertEquals(5, ConfigCliUtils.parseLong(args, "missing", 5));
    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.parseLong(args, "neg", 5));
    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.parseLong(args, "text", 5));
  }
}
