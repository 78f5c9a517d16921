package ca.gc.cra.cot.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"contract=DEBM", " weeks = 26 ", "in="});

    assertEquals("DEBM", map.get("contract"));
    assertEquals("26", map.get("weeks"));
    assertEquals("", map.get("in"));
  }

  @Test
  void valueMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=markets"});

    assertEquals("team=markets", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"DEBM"}));
    assertEquals("argument must be key=value (was 'DEBM')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=DEBM"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"con tract=DEBM"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"contract=DE\u0007BM"}));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"show", "--VERBOSE", "contract=DEBM", "-h", "--dry-run"});

    assertArrayEquals(new String[] {"show", "contract=DEBM"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertTrue(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag("--force"));
  }

  @Test
  void configPathIsExtracted() {
    Map<String, String> args = new HashMap<>(Map.of("config", " cot.yaml ", "weeks", "4"));

    assertEquals("cot.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("verbose", "TRUE"), "verbose", false));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of(), "verbose", false));
  }
}
