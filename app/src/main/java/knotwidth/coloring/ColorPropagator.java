package knotwidth.coloring;

import java.util.List;
import java.util.Objects;
import knotwidth.core.Crossing;
import knotwidth.core.KnotDiagram;

/**
 * Maximal extension of a seed coloring.
 *
 * <p>A crossing whose over-strand is colored passes the color of one under-strand to the other
 * when exactly one of them is colored. Crossings with both under-strands colored are left alone,
 * whatever their colors; {@link CrossingCounter} reports them instead. Passes repeat until one
 * makes no assignment. The set of colored strands at the fixed point does not depend on the visit
 * order; colors are visited in seed order and members in the order they were colored, so the
 * colors themselves are reproducible.
 */
public class ColorPropagator {

  public ColorPartition propagate(KnotDiagram diagram, int... seeds) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(seeds, "seeds");
    ColorPartition partition = new ColorPartition(diagram.strandCount(), seeds);
    extend(diagram, partition);
    return partition;
  }

  /**
   * Runs passes on {@code partition} until it is closed.
   *
   * @return number of strands colored; 0 when the partition was already a fixed point
   */
  public int extend(KnotDiagram diagram, ColorPartition partition) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(partition, "partition");
    if (partition.strandCount() != diagram.strandCount()) {
      throw new IllegalArgumentException("partition does not belong to this diagram");
    }
    int assigned = 0;
    boolean changed = true;
    while (changed) {
      int pass = runPass(diagram, partition);
      assigned += pass;
      changed = pass > 0;
    }
    return assigned;
  }

  private int runPass(KnotDiagram diagram, ColorPartition partition) {
    int assigned = 0;
    for (int color = 0; color < partition.colorCount(); color++) {
      // members grow while we walk them
      List<Integer> part = partition.membersView(color);
      for (int m = 0; m < part.size(); m++) {
        for (Crossing crossing : diagram.crossingsOver(part.get(m))) {
          int a = crossing.startUnder();
          int b = crossing.endUnder();
          boolean aColored = partition.isColored(a);
          boolean bColored = partition.isColored(b);
          if (aColored && !bColored) {
            partition.assign(b, partition.colorOf(a));
            assigned++;
          } else if (!aColored && bColored) {
            partition.assign(a, partition.colorOf(b));
            assigned++;
          }
        }
      }
    }
    return assigned;
  }
}
