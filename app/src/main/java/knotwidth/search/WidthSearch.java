package knotwidth.search;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import knotwidth.coloring.ColorPartition;
import knotwidth.coloring.ColorPropagator;
import knotwidth.coloring.CrossingCounter;
import knotwidth.core.DiagramException;
import knotwidth.core.KnotDiagram;
import knotwidth.core.SearchOptions;
import knotwidth.core.WidthBound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which width bound applies to a diagram realizing Wirtinger number four.
 *
 * <p>Every triple of strands is tried as a seed set. When the closure of a triple leaves a
 * multicolored crossing, each strand the triple left uncolored is added as a fourth seed in turn;
 * if one of these four-seed closures colors the whole diagram the bound is 28 and the search stops
 * at once. Otherwise the bound is 32.
 *
 * <p>In parallel mode triples are evaluated concurrently and the first covering trial ends the
 * search; the bound is the same as in sequential mode.
 */
public final class WidthSearch {
  private static final Logger LOG = LoggerFactory.getLogger(WidthSearch.class);

  static final int SEED_COUNT = 3;

  private final ColorPropagator propagator;
  private final CrossingCounter counter;
  private final SearchOptions options;

  public WidthSearch() {
    this(new ColorPropagator(), new CrossingCounter(), SearchOptions.sequential());
  }

  public WidthSearch(SearchOptions options) {
    this(new ColorPropagator(), new CrossingCounter(), options);
  }

  public WidthSearch(ColorPropagator propagator, CrossingCounter counter, SearchOptions options) {
    this.propagator = Objects.requireNonNull(propagator, "propagator");
    this.counter = Objects.requireNonNull(counter, "counter");
    this.options = SearchOptions.normalize(options);
  }

  public SearchResult search(KnotDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int n = diagram.strandCount();
    if (n < SEED_COUNT) {
      throw new DiagramException(
          "A width search needs at least " + SEED_COUNT + " strands, diagram has " + n);
    }

    SearchRun run = new SearchRun();
    long start = System.nanoTime();
    SeedCombinations triples = new SeedCombinations(n, SEED_COUNT);
    LOG.debug(
        "Searching {} seed triples over {} strands (parallel={})",
        triples.count(),
        n,
        options.parallel());

    boolean covered =
        options.parallel()
            ? searchParallel(diagram, triples, run)
            : searchSequential(diagram, triples, run);
    run.recordElapsed((System.nanoTime() - start) / 1_000_000);

    WidthBound bound = covered ? WidthBound.TWENTY_EIGHT : WidthBound.THIRTY_TWO;
    LOG.info(
        "Width bound {} after {} seed triples ({} ms)",
        bound,
        run.seedSetsExamined(),
        run.elapsedMillis());
    return new SearchResult(diagram, bound, run);
  }

  private boolean searchSequential(KnotDiagram diagram, SeedCombinations triples, SearchRun run) {
    for (int[] seeds : triples) {
      if (trial(diagram, seeds, run)) {
        return true;
      }
    }
    return false;
  }

  private boolean searchParallel(KnotDiagram diagram, SeedCombinations triples, SearchRun run) {
    ForkJoinPool pool =
        options.parallelism() == ForkJoinPool.getCommonPoolParallelism()
            ? ForkJoinPool.commonPool()
            : new ForkJoinPool(options.parallelism());
    try {
      return pool.submit(
              () -> triples.stream().parallel().anyMatch(seeds -> trial(diagram, seeds, run)))
          .join();
    } finally {
      if (pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
  }

  /** Returns true when {@code seeds} plus one uncolored strand colors the whole diagram. */
  private boolean trial(KnotDiagram diagram, int[] seeds, SearchRun run) {
    run.recordSeedSet();
    ColorPartition partition = propagate(diagram, seeds, run);
    int multicolored = counter.countMulticolored(diagram, partition);
    if (multicolored == 0) {
      return false;
    }
    run.recordMulticolored();
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Seeds {} leave {} multicolored crossings: {}",
          Arrays.toString(seeds),
          multicolored,
          partition);
    }

    int[] extended = Arrays.copyOf(seeds, SEED_COUNT + 1);
    for (int candidate : partition.uncolored()) {
      extended[SEED_COUNT] = candidate;
      run.recordExtension();
      if (propagate(diagram, extended, run).coversAll()) {
        if (run.recordCovering(extended)) {
          LOG.debug("Seeds {} color every strand", Arrays.toString(extended));
        }
        return true;
      }
    }
    return false;
  }

  private ColorPartition propagate(KnotDiagram diagram, int[] seeds, SearchRun run) {
    run.recordPropagation();
    return propagator.propagate(diagram, seeds);
  }
}
