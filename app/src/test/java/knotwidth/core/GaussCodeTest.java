package knotwidth.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

final class GaussCodeTest {

  @Test
  void spanWrapsPastTheEnd() {
    GaussCode code = GaussCode.of(1, -2, 3, -1, 2, -3);
    assertEquals(List.of(-3, 1, -2), code.span(5, 1));
    assertEquals(List.of(-2, 3, -1), code.span(1, 3));
  }

  @Test
  void locatesUnderPasses() {
    GaussCode code = GaussCode.of(1, 2, -1, 3, -2, -3);
    assertEquals(2, code.firstUnderPosition());
    assertEquals(3, code.underPassCount());
    assertEquals(0, code.next(5));
    assertEquals(-1, GaussCode.of(1, 2).firstUnderPosition());
  }

  @Test
  void rejectsZero() {
    assertThrows(IllegalArgumentException.class, () -> GaussCode.of(1, 0, -1));
  }
}
