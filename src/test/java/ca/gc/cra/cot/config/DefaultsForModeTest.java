package ca.gc.cra.cot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void commonDefaultsApplyToEveryMode() {
    for (String mode : new String[] {"import", "show", "list"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("data", defaults.get("dataDir"));
      assertEquals("none", defaults.get("metricsExporter"));
      assertEquals("false", defaults.get("verbose"));
    }
  }

  @Test
  void importDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("import");

    assertEquals("Weekly_Report", defaults.get("primarySection"));
    assertEquals("true", defaults.get("deduplicate"));
    assertEquals("", defaults.get("in"));
    assertFalse(defaults.containsKey("weeks"));
  }

  @Test
  void showDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Show ");

    assertEquals("13", defaults.get("weeks"));
    assertEquals("total", defaults.get("positionType"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("export"));
  }

  @Test
  void defaultsBuildAValidConfig() {
    ArchiveConfig config = ArchiveConfig.fromMap(DefaultsForMode.asFlatMap("show"));

    assertEquals(ArchiveConfig.defaults(), config);
  }
}
