package knotwidth.coloring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import knotwidth.WidthBoundCalculator;
import knotwidth.core.KnotDiagram;
import knotwidth.testing.KnotFixtures;
import org.junit.jupiter.api.Test;

final class ColorPropagatorTest {
  private final ColorPropagator propagator = new ColorPropagator();

  @Test
  void seedsStartInTheirOwnColor() {
    KnotDiagram diagram = KnotFixtures.diagram(5);

    ColorPartition partition = propagator.propagate(diagram, 4, 0, 2);

    assertEquals(3, partition.colorCount());
    assertEquals(0, partition.colorOf(4));
    assertEquals(1, partition.colorOf(0));
    assertEquals(2, partition.colorOf(2));
    assertEquals(List.of(1, 3), partition.uncolored());
  }

  @Test
  void colorFlowsAcrossCrossingsOfColoredOverStrands() {
    // 0 over (0, 3) colors 3, then 3 over (4, 3) colors 4
    KnotDiagram diagram =
        KnotFixtures.diagram(5, new int[] {0, 0, 3}, new int[] {3, 4, 3}, new int[] {4, 1, 2});

    ColorPartition partition = propagator.propagate(diagram, 0, 1, 2);

    assertTrue(partition.coversAll());
    assertEquals(List.of(0, 3, 4), partition.members(0));
    assertEquals(List.of(1), partition.members(1));
  }

  @Test
  void uncoloredOverStrandDoesNotPropagate() {
    KnotDiagram diagram = KnotFixtures.diagram(4, new int[] {3, 0, 1});

    ColorPartition partition = propagator.propagate(diagram, 0, 2);

    assertFalse(partition.isColored(1), "Strand 3 is not colored, so its crossing is inert");
  }

  @Test
  void bothColoredCrossingIsLeftAlone() {
    KnotDiagram diagram = KnotFixtures.diagram(4, new int[] {0, 1, 2}, new int[] {1, 2, 3});

    ColorPartition partition = propagator.propagate(diagram, 0, 1, 2);

    assertEquals(1, partition.colorOf(1));
    assertEquals(2, partition.colorOf(2));
    assertEquals(2, partition.colorOf(3), "Strand 3 takes the color of strand 2");
  }

  @Test
  void fixedPointIsIdempotent() {
    KnotDiagram diagram = WidthBoundCalculator.buildDiagram(KnotFixtures.SEVEN_STRANDS);

    for (int[] seeds : List.of(new int[] {0, 1, 2}, new int[] {0, 3, 4}, new int[] {2, 5, 6})) {
      ColorPartition partition = propagator.propagate(diagram, seeds);
      int colored = partition.coloredCount();

      assertEquals(0, propagator.extend(diagram, partition), "Second closure adds nothing");
      assertEquals(colored, partition.coloredCount());
    }
  }

  @Test
  void partsStayDisjoint() {
    KnotDiagram diagram = WidthBoundCalculator.buildDiagram(KnotFixtures.EIGHT_STRANDS);

    ColorPartition partition = propagator.propagate(diagram, 0, 1, 2);

    int total = 0;
    for (int color = 0; color < partition.colorCount(); color++) {
      for (int strand : partition.members(color)) {
        assertEquals(color, partition.colorOf(strand));
      }
      total += partition.members(color).size();
    }
    assertEquals(partition.coloredCount(), total);
    assertEquals(List.of(4, 5, 6), partition.uncolored());
  }

  @Test
  void rejectsInvalidSeeds() {
    KnotDiagram diagram = KnotFixtures.diagram(3);

    assertThrows(IllegalArgumentException.class, () -> propagator.propagate(diagram, 0, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> propagator.propagate(diagram, 0, 1, 3));
  }
}
