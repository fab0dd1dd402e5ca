package knotwidth.coloring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import knotwidth.core.StrandLabels;

/**
 * Assignment of strands to seed colors for one trial.
 *
 * <p>Color {@code c} is the color of the {@code c}-th seed. Members of each color are kept in the
 * order they were colored, and a reverse index answers "which color is this strand" in constant
 * time. A strand is colored at most once.
 */
public final class ColorPartition {
  static final int UNCOLORED = -1;

  private final int[] seeds;
  private final int[] colorOf;
  private final List<List<Integer>> members;
  private final BitSet colored;

  ColorPartition(int strandCount, int[] seeds) {
    this.seeds = seeds.clone();
    this.colorOf = new int[strandCount];
    Arrays.fill(colorOf, UNCOLORED);
    this.members = new ArrayList<>(seeds.length);
    this.colored = new BitSet(strandCount);
    for (int color = 0; color < seeds.length; color++) {
      int seed = seeds[color];
      if (seed < 0 || seed >= strandCount) {
        throw new IllegalArgumentException("seed " + seed + " is not a strand index");
      }
      if (colored.get(seed)) {
        throw new IllegalArgumentException("seed " + seed + " given twice");
      }
      List<Integer> part = new ArrayList<>();
      part.add(seed);
      members.add(part);
      colorOf[seed] = color;
      colored.set(seed);
    }
  }

  void assign(int strand, int color) {
    if (colorOf[strand] != UNCOLORED) {
      throw new IllegalStateException(
          "strand " + StrandLabels.label(strand) + " already has color " + colorOf[strand]);
    }
    colorOf[strand] = color;
    members.get(color).add(strand);
    colored.set(strand);
  }

  List<Integer> membersView(int color) {
    return members.get(color);
  }

  public int colorCount() {
    return seeds.length;
  }

  public int strandCount() {
    return colorOf.length;
  }

  public boolean isColored(int strand) {
    return colorOf[strand] != UNCOLORED;
  }

  /** Color of {@code strand}, or -1 when it is uncolored. */
  public int colorOf(int strand) {
    return colorOf[strand];
  }

  public List<Integer> members(int color) {
    return List.copyOf(members.get(color));
  }

  public int coloredCount() {
    return colored.cardinality();
  }

  public boolean coversAll() {
    return colored.cardinality() == colorOf.length;
  }

  /** Uncolored strand indices in ascending order. */
  public List<Integer> uncolored() {
    List<Integer> result = new ArrayList<>();
    for (int i = colored.nextClearBit(0); i < colorOf.length; i = colored.nextClearBit(i + 1)) {
      result.add(i);
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    for (int color = 0; color < seeds.length; color++) {
      if (color > 0) {
        builder.append(", ");
      }
      builder.append(StrandLabels.label(seeds[color])).append("=[");
      List<Integer> part = members.get(color);
      for (int i = 0; i < part.size(); i++) {
        if (i > 0) {
          builder.append(' ');
        }
        builder.append(StrandLabels.label(part.get(i)));
      }
      builder.append(']');
    }
    return builder.append('}').toString();
  }
}
