package knotwidth.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Circular sequence of signed crossing labels. A positive entry is an over-pass, a negative entry
 * an under-pass; the magnitude names the crossing.
 */
public final class GaussCode {
  private final int[] entries;

  private GaussCode(int[] entries) {
    this.entries = entries;
  }

  public static GaussCode of(int... entries) {
    Objects.requireNonNull(entries, "entries");
    for (int entry : entries) {
      if (entry == 0) {
        throw new IllegalArgumentException("Gauss code entries must be nonzero");
      }
    }
    return new GaussCode(entries.clone());
  }

  public int length() {
    return entries.length;
  }

  public boolean isEmpty() {
    return entries.length == 0;
  }

  public int get(int position) {
    return entries[position];
  }

  public boolean isUnder(int position) {
    return entries[position] < 0;
  }

  /** Position following {@code position}, wrapping past the end. */
  public int next(int position) {
    return (position + 1) % entries.length;
  }

  /** First under-pass position, or -1 when the code has none. */
  public int firstUnderPosition() {
    for (int i = 0; i < entries.length; i++) {
      if (entries[i] < 0) {
        return i;
      }
    }
    return -1;
  }

  public int underPassCount() {
    int count = 0;
    for (int entry : entries) {
      if (entry < 0) {
        count++;
      }
    }
    return count;
  }

  /**
   * Entries from {@code from} through {@code to} inclusive, concatenating tail and head when the
   * span wraps past the end of the code.
   */
  public List<Integer> span(int from, int to) {
    int[] slice;
    if (from > to) {
      slice = new int[entries.length - from + to + 1];
      System.arraycopy(entries, from, slice, 0, entries.length - from);
      System.arraycopy(entries, 0, slice, entries.length - from, to + 1);
    } else {
      slice = Arrays.copyOfRange(entries, from, to + 1);
    }
    return Arrays.stream(slice).boxed().toList();
  }

  public int[] toArray() {
    return entries.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GaussCode other)) {
      return false;
    }
    return Arrays.equals(entries, other.entries);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(entries);
  }

  @Override
  public String toString() {
    return Arrays.toString(entries);
  }
}
