package knotwidth.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Strands of a diagram together with the crossings each strand passes over. Instances are
 * immutable and may be shared between concurrent search trials.
 */
public final class KnotDiagram {
  private final List<Strand> strands;
  private final List<List<Crossing>> crossingsByOver;
  private final int crossingCount;

  public KnotDiagram(List<Strand> strands, List<List<Crossing>> crossingsByOver) {
    Objects.requireNonNull(strands, "strands");
    Objects.requireNonNull(crossingsByOver, "crossingsByOver");
    if (strands.size() != crossingsByOver.size()) {
      throw new IllegalArgumentException(
          "expected one crossing list per strand, got "
              + crossingsByOver.size()
              + " for "
              + strands.size()
              + " strands");
    }
    for (int i = 0; i < strands.size(); i++) {
      if (strands.get(i).index() != i) {
        throw new IllegalArgumentException(
            "strand at position " + i + " has index " + strands.get(i).index());
      }
    }
    List<List<Crossing>> copy = new ArrayList<>(crossingsByOver.size());
    int total = 0;
    for (int i = 0; i < crossingsByOver.size(); i++) {
      List<Crossing> crossings = List.copyOf(crossingsByOver.get(i));
      for (Crossing crossing : crossings) {
        if (crossing.overStrand() != i) {
          throw new IllegalArgumentException(
              "crossing " + crossing.label() + " listed under strand " + i);
        }
        checkIndex(crossing.startUnder(), strands.size());
        checkIndex(crossing.endUnder(), strands.size());
      }
      total += crossings.size();
      copy.add(crossings);
    }
    this.strands = List.copyOf(strands);
    this.crossingsByOver = List.copyOf(copy);
    this.crossingCount = total;
  }

  private static void checkIndex(int index, int size) {
    if (index >= size) {
      throw new IllegalArgumentException("unknown strand index " + index);
    }
  }

  public int strandCount() {
    return strands.size();
  }

  public List<Strand> strands() {
    return strands;
  }

  public Strand strand(int index) {
    return strands.get(index);
  }

  /** Crossings {@code strand} passes over, in the order they occur along the strand. */
  public List<Crossing> crossingsOver(int strand) {
    return crossingsByOver.get(strand);
  }

  public int crossingCount() {
    return crossingCount;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (Strand strand : strands) {
      builder.append(strand.label()).append(": ").append(strand.entries()).append(" over [");
      List<Crossing> crossings = crossingsByOver.get(strand.index());
      for (int i = 0; i < crossings.size(); i++) {
        if (i > 0) {
          builder.append(", ");
        }
        Crossing crossing = crossings.get(i);
        builder
            .append('(')
            .append(StrandLabels.label(crossing.startUnder()))
            .append(", ")
            .append(StrandLabels.label(crossing.endUnder()))
            .append(')');
      }
      builder.append("]\n");
    }
    return builder.toString();
  }
}
