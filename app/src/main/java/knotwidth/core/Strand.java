package knotwidth.core;

import java.util.List;
import java.util.Objects;

/**
 * Arc of the diagram running from one under-pass, over any number of crossings, to the next
 * under-pass.
 *
 * @param index dense identifier, unique within one diagram
 * @param startPosition position of the opening under-pass in the Gauss code
 * @param entries signed entries covered by the strand, both under-passes included
 */
public record Strand(int index, int startPosition, List<Integer> entries) {

  public Strand {
    Objects.requireNonNull(entries, "entries");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
    if (entries.size() < 2) {
      throw new IllegalArgumentException("a strand spans at least two under-passes");
    }
    entries = List.copyOf(entries);
  }

  public int first() {
    return entries.get(0);
  }

  public int last() {
    return entries.get(entries.size() - 1);
  }

  /** Over-pass labels in the order the strand crosses them. */
  public List<Integer> overPasses() {
    return entries.subList(1, entries.size() - 1).stream().filter(e -> e > 0).toList();
  }

  public String label() {
    return StrandLabels.label(index);
  }

  @Override
  public String toString() {
    return label() + entries;
  }
}
