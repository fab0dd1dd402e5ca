package knotwidth.core;

/**
 * A crossing seen from its over-strand.
 *
 * @param overStrand strand passing over
 * @param label crossing magnitude in the Gauss code
 * @param startUnder strand whose entries begin with {@code -label}
 * @param endUnder strand whose entries end with {@code -label}
 */
public record Crossing(int overStrand, int label, int startUnder, int endUnder) {

  public Crossing {
    if (overStrand < 0 || startUnder < 0 || endUnder < 0) {
      throw new IllegalArgumentException("strand indices must be non-negative");
    }
  }
}
