package knotwidth.diagram;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import knotwidth.core.Crossing;
import knotwidth.core.DiagramException;
import knotwidth.core.KnotDiagram;
import knotwidth.core.Strand;

/**
 * Resolves, for every over-pass of every strand, the two strands meeting underneath: the one that
 * starts at the matching under-pass and the one that ends there.
 */
public final class CrossingGraphBuilder {

  public KnotDiagram build(List<Strand> strands) {
    Objects.requireNonNull(strands, "strands");
    Map<Integer, Integer> byFirst = new HashMap<>();
    Map<Integer, Integer> byLast = new HashMap<>();
    for (Strand strand : strands) {
      byFirst.putIfAbsent(strand.first(), strand.index());
      byLast.putIfAbsent(strand.last(), strand.index());
    }

    List<List<Crossing>> crossings = new ArrayList<>(strands.size());
    for (Strand strand : strands) {
      List<Crossing> over = new ArrayList<>();
      for (int label : strand.overPasses()) {
        Integer startUnder = byFirst.get(-label);
        Integer endUnder = byLast.get(-label);
        if (startUnder == null || endUnder == null) {
          throw new DiagramException(
              "No "
                  + (startUnder == null ? "strand starting" : "strand ending")
                  + " at under-pass "
                  + (-label)
                  + " for crossing "
                  + label
                  + " over strand "
                  + strand.label()
                  + strand.entries());
        }
        over.add(new Crossing(strand.index(), label, startUnder, endUnder));
      }
      crossings.add(over);
    }
    return new KnotDiagram(strands, crossings);
  }
}
