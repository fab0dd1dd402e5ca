package knotwidth.testing;

import java.util.ArrayList;
import java.util.List;
import knotwidth.core.Crossing;
import knotwidth.core.GaussCode;
import knotwidth.core.KnotDiagram;
import knotwidth.core.Strand;

/** Gauss codes and hand-built diagrams shared by the tests. */
public final class KnotFixtures {

  /** Trefoil: three strands, every seed triple colors everything. */
  public static final GaussCode TREFOIL = GaussCode.of(-1, 2, -3, 1, -2, 3);

  public static final GaussCode FIGURE_EIGHT = GaussCode.of(1, -2, 3, -1, 2, -4, 4, -3);

  /** Eight strands; the very first seed triple plus strand E colors the diagram. */
  public static final GaussCode EIGHT_STRANDS =
      GaussCode.of(1, -2, 3, -4, 2, -5, 6, -1, 4, -7, 8, -6, 5, -3, 7, -8);

  /** Seven strands; the tenth seed triple (A, D, E) plus strand B colors the diagram. */
  public static final GaussCode SEVEN_STRANDS =
      GaussCode.of(7, -1, 3, -5, 1, -2, 5, -7, 2, -4, 4, -6, 6, -3);

  /** Five strands with kinks; no seed triple can be extended to a full coloring. */
  public static final GaussCode FIVE_STRANDS_WITH_KINKS =
      GaussCode.of(2, -3, 5, -5, 1, -1, 3, -2, 4, -4);

  private KnotFixtures() {}

  /**
   * Alternating code with {@code crossings} crossings in which strand i passes over the under-pass
   * joining strands i + 2 and i + 3; yields as many strands as crossings.
   */
  public static GaussCode alternatingChain(int crossings) {
    int[] entries = new int[crossings * 2];
    for (int i = 0; i < crossings; i++) {
      entries[2 * i] = ((i + 2) % crossings) + 1;
      entries[2 * i + 1] = -(i + 1);
    }
    return GaussCode.of(entries);
  }

  /**
   * Diagram given directly by its crossing relation. Each row is {over, startUnder, endUnder}.
   * Strand entries are placeholders.
   */
  public static KnotDiagram diagram(int strandCount, int[]... crossings) {
    List<Strand> strands = new ArrayList<>();
    List<List<Crossing>> byOver = new ArrayList<>();
    for (int i = 0; i < strandCount; i++) {
      strands.add(new Strand(i, i, List.of(-(i + 1), -(i + 2))));
      byOver.add(new ArrayList<>());
    }
    int label = 1;
    for (int[] row : crossings) {
      byOver.get(row[0]).add(new Crossing(row[0], label++, row[1], row[2]));
    }
    return new KnotDiagram(strands, byOver);
  }
}
