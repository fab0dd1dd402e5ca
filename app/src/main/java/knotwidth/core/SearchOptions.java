package knotwidth.core;

/**
 * Configuration for the seed search.
 *
 * <p>Callers that pass nothing get {@link #sequential()}.
 */
public record SearchOptions(boolean parallel, int parallelism) {
  public SearchOptions {
    if (parallelism < 0) {
      throw new IllegalArgumentException("parallelism must be non-negative");
    }
  }

  public static SearchOptions sequential() {
    return new SearchOptions(false, 1);
  }

  public static SearchOptions parallel(int parallelism) {
    return normalize(new SearchOptions(true, parallelism));
  }

  public static SearchOptions normalize(SearchOptions options) {
    if (options == null) {
      return sequential();
    }
    int parallelism = options.parallelism() > 0 ? options.parallelism() : availableProcessors();
    return new SearchOptions(options.parallel(), parallelism);
  }

  private static int availableProcessors() {
    return Runtime.getRuntime().availableProcessors();
  }
}
