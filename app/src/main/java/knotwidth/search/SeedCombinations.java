package knotwidth.search;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily produced {@code size}-element subsets of {@code 0..n-1}, in lexicographic order. Each
 * subset is returned as a fresh ascending array.
 */
public final class SeedCombinations implements Iterable<int[]> {
  private final int n;
  private final int size;

  public SeedCombinations(int n, int size) {
    if (n < 0 || size < 0) {
      throw new IllegalArgumentException("n and size must be non-negative");
    }
    this.n = n;
    this.size = size;
  }

  /** Number of subsets, C(n, size). */
  public long count() {
    if (size > n) {
      return 0;
    }
    long result = 1;
    for (int i = 1; i <= size; i++) {
      result = result * (n - size + i) / i;
    }
    return result;
  }

  @Override
  public Iterator<int[]> iterator() {
    return new CombinationIterator();
  }

  public Stream<int[]> stream() {
    return StreamSupport.stream(
        Spliterators.spliterator(
            iterator(),
            count(),
            Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
        false);
  }

  private final class CombinationIterator implements Iterator<int[]> {
    private int[] current;
    private boolean exhausted = size > n;

    @Override
    public boolean hasNext() {
      if (exhausted) {
        return false;
      }
      return current == null || canAdvance();
    }

    @Override
    public int[] next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (current == null) {
        current = new int[size];
        for (int i = 0; i < size; i++) {
          current[i] = i;
        }
      } else {
        advance();
      }
      if (size == 0) {
        exhausted = true;
      }
      return current.clone();
    }

    private boolean canAdvance() {
      for (int i = size - 1; i >= 0; i--) {
        if (current[i] < n - size + i) {
          return true;
        }
      }
      return false;
    }

    // bump the rightmost position that still has room, reset everything after it
    private void advance() {
      int i = size - 1;
      while (current[i] == n - size + i) {
        i--;
      }
      current[i]++;
      for (int j = i + 1; j < size; j++) {
        current[j] = current[j - 1] + 1;
      }
    }
  }
}
