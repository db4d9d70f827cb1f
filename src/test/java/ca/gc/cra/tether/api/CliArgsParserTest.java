package ca.gc.cra.tether.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"registrationId=reg-1", " idScope = 0ne001 "});

    assertEquals(List.of("registrationId", "idScope"), List.copyOf(map.keySet()));
    assertEquals("0ne001", map.get("idScope"));
  }

  @Test
  void keepsEqualsSignsInValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"sasToken=SharedAccessSignature sr=a&sig=b=="});

    assertEquals("SharedAccessSignature sr=a&sig=b==", map.get("sasToken"));
  }

  @Test
  void skipsBlankArguments() {
    assertTrue(CliArgsParser.toMap(new String[] {"", "  "}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0007b"}));
  }

  @Test
  void rejectsRepeatedKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"count=1", "count=2"}));
  }
}
