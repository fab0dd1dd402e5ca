package knotwidth.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import knotwidth.core.DiagramException;
import knotwidth.core.GaussCode;
import knotwidth.core.Strand;
import knotwidth.testing.KnotFixtures;
import org.junit.jupiter.api.Test;

final class StrandDecomposerTest {
  private final StrandDecomposer decomposer = new StrandDecomposer();

  @Test
  void trefoilHasThreeStrands() {
    List<Strand> strands = decomposer.decompose(KnotFixtures.TREFOIL);

    assertEquals(3, strands.size());
    assertEquals(List.of(-1, 2, -3), strands.get(0).entries());
    assertEquals(List.of(-3, 1, -2), strands.get(1).entries());
    assertEquals(List.of(-2, 3, -1), strands.get(2).entries(), "Last strand wraps around");
    assertEquals("C", strands.get(2).label());
  }

  @Test
  void scanStartsAtFirstUnderPass() {
    List<Strand> strands = decomposer.decompose(KnotFixtures.FIGURE_EIGHT);

    assertEquals(4, strands.size());
    assertEquals(1, strands.get(0).startPosition());
    assertEquals(List.of(-2, 3, -1), strands.get(0).entries());
    assertEquals(List.of(-3, 1, -2), strands.get(3).entries());
  }

  @Test
  void strandsCoverEveryPositionOnce() {
    for (GaussCode code :
        List.of(
            KnotFixtures.TREFOIL,
            KnotFixtures.FIGURE_EIGHT,
            KnotFixtures.EIGHT_STRANDS,
            KnotFixtures.SEVEN_STRANDS,
            KnotFixtures.FIVE_STRANDS_WITH_KINKS,
            GaussCode.of(1, 2, -1, 3, -2, -3))) {
      List<Strand> strands = decomposer.decompose(code);

      assertEquals(code.underPassCount(), strands.size(), "One strand per under-pass in " + code);
      int covered = 0;
      Set<Integer> starts = new HashSet<>();
      Set<Integer> ends = new HashSet<>();
      for (Strand strand : strands) {
        covered += strand.entries().size() - 1;
        starts.add(strand.first());
        ends.add(strand.last());
        assertTrue(strand.first() < 0 && strand.last() < 0, "Strands open and close under");
      }
      assertEquals(code.length(), covered, "Positions covered exactly once in " + code);
      assertEquals(starts, ends, "Opening and closing under-passes match in " + code);
    }
  }

  @Test
  void noAlphabetCap() {
    List<Strand> strands = decomposer.decompose(KnotFixtures.alternatingChain(40));

    assertEquals(40, strands.size());
    assertEquals("AN", strands.get(39).label());
  }

  @Test
  void adjacentUnderPassesFormShortStrand() {
    List<Strand> strands = decomposer.decompose(GaussCode.of(1, 2, -1, 3, -2, -3));

    assertEquals(List.of(-1, 3, -2), strands.get(0).entries());
    assertEquals(List.of(-2, -3), strands.get(1).entries());
    assertEquals(List.of(-3, 1, 2, -1), strands.get(2).entries());
  }

  @Test
  void rejectsDegenerateCodes() {
    assertThrows(DiagramException.class, () -> decomposer.decompose(GaussCode.of()));
    assertThrows(DiagramException.class, () -> decomposer.decompose(GaussCode.of(1, 2, 3)));
    assertThrows(DiagramException.class, () -> decomposer.decompose(GaussCode.of(1, -1)));
  }
}
