package knotwidth.search;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters and timing for one width search. Safe to update from concurrent trials.
 */
public final class SearchRun {
  private final AtomicInteger seedSetsExamined = new AtomicInteger();
  private final AtomicInteger multicoloredSeedSets = new AtomicInteger();
  private final AtomicInteger extensionTrials = new AtomicInteger();
  private final AtomicInteger propagations = new AtomicInteger();
  private final AtomicLong elapsedMillis = new AtomicLong();
  private final AtomicReference<int[]> coveringSeeds = new AtomicReference<>();

  void recordSeedSet() {
    seedSetsExamined.incrementAndGet();
  }

  void recordMulticolored() {
    multicoloredSeedSets.incrementAndGet();
  }

  void recordExtension() {
    extensionTrials.incrementAndGet();
  }

  void recordPropagation() {
    propagations.incrementAndGet();
  }

  void recordElapsed(long millis) {
    elapsedMillis.set(millis);
  }

  /** Keeps the first covering seed set reported; later ones are ignored. */
  boolean recordCovering(int[] seeds) {
    return coveringSeeds.compareAndSet(null, seeds.clone());
  }

  public int seedSetsExamined() {
    return seedSetsExamined.get();
  }

  /** Seed triples whose closure left at least one multicolored crossing. */
  public int multicoloredSeedSets() {
    return multicoloredSeedSets.get();
  }

  public int extensionTrials() {
    return extensionTrials.get();
  }

  public int propagations() {
    return propagations.get();
  }

  public long elapsedMillis() {
    return elapsedMillis.get();
  }

  /** Four seeds whose closure colors every strand, or null if none was found. */
  public int[] coveringSeeds() {
    int[] seeds = coveringSeeds.get();
    return seeds == null ? null : seeds.clone();
  }

  @Override
  public String toString() {
    return "SearchRun{seedSets="
        + seedSetsExamined.get()
        + ", multicolored="
        + multicoloredSeedSets.get()
        + ", extensions="
        + extensionTrials.get()
        + ", propagations="
        + propagations.get()
        + ", elapsedMs="
        + elapsedMillis.get()
        + ", covering="
        + Arrays.toString(coveringSeeds.get())
        + '}';
  }
}
