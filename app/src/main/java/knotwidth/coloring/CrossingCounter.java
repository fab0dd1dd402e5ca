package knotwidth.coloring;

import java.util.Objects;
import knotwidth.core.Crossing;
import knotwidth.core.KnotDiagram;

/** Counts multicolored crossings: both under-strands colored, but with different colors. */
public final class CrossingCounter {

  /** Multicolored crossings whose over-strand is itself colored. */
  public int countMulticolored(KnotDiagram diagram, ColorPartition partition) {
    return count(diagram, partition, true);
  }

  /** Multicolored crossings regardless of the over-strand's color. */
  public int countAll(KnotDiagram diagram, ColorPartition partition) {
    return count(diagram, partition, false);
  }

  private int count(KnotDiagram diagram, ColorPartition partition, boolean coloredOverOnly) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(partition, "partition");
    int count = 0;
    for (int over = 0; over < diagram.strandCount(); over++) {
      if (coloredOverOnly && !partition.isColored(over)) {
        continue;
      }
      for (Crossing crossing : diagram.crossingsOver(over)) {
        if (isMulticolored(crossing, partition)) {
          count++;
        }
      }
    }
    return count;
  }

  static boolean isMulticolored(Crossing crossing, ColorPartition partition) {
    int a = partition.colorOf(crossing.startUnder());
    int b = partition.colorOf(crossing.endUnder());
    return a != ColorPartition.UNCOLORED && b != ColorPartition.UNCOLORED && a != b;
  }
}
