package knotwidth.parse;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import knotwidth.core.GaussCode;
import knotwidth.core.GaussCodeParseException;
import org.junit.jupiter.api.Test;

final class GaussCodeParserTest {

  @Test
  void stripsEmbeddedCommas() {
    GaussCode code = GaussCodeParser.parse(List.of("-1,", "2,", "-3", ",1", "-2,", "3"));
    assertArrayEquals(new int[] {-1, 2, -3, 1, -2, 3}, code.toArray());
  }

  @Test
  void parsesFreeFormLines() {
    assertEquals(
        GaussCode.of(-1, 2, -3, 1, -2, 3), GaussCodeParser.parseText("[-1, 2, -3, 1, -2, 3]"));
    assertEquals(GaussCode.of(-1, 2, -3), GaussCodeParser.parseText("  -1 2\t-3 "));
    assertEquals(List.of("-1", "2", "-3"), GaussCodeParser.tokenize("(-1;2,-3)"));
  }

  @Test
  void rejectsNonIntegerToken() {
    GaussCodeParseException ex =
        assertThrows(
            GaussCodeParseException.class, () -> GaussCodeParser.parse(List.of("-1", "2x", "3")));
    assertEquals("2x", ex.token());
    assertEquals(1, ex.position(), "Position should point at the offending token");
  }

  @Test
  void rejectsZeroLabel() {
    GaussCodeParseException ex =
        assertThrows(GaussCodeParseException.class, () -> GaussCodeParser.parse(List.of("0,")));
    assertEquals(0, ex.position());
  }

  @Test
  void emptyInputGivesEmptyCode() {
    assertEquals(0, GaussCodeParser.parse(List.of()).length());
  }
}
