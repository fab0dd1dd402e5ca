package knotwidth;

import java.util.List;
import java.util.Objects;
import knotwidth.core.GaussCode;
import knotwidth.core.KnotDiagram;
import knotwidth.core.SearchOptions;
import knotwidth.diagram.CrossingGraphBuilder;
import knotwidth.diagram.StrandDecomposer;
import knotwidth.parse.GaussCodeParser;
import knotwidth.search.SearchResult;
import knotwidth.search.WidthSearch;

/**
 * Upper bound on the Gabai width of a knot diagram, computed from its Gauss code.
 *
 * <p>The caller guarantees that the diagram realizes Wirtinger number four; this is not checked.
 * Neither is the combinatorial validity of the code.
 */
public final class WidthBoundCalculator {

  private WidthBoundCalculator() {}

  /**
   * Returns {@code "28"} or {@code "32"} for a Gauss code given as tokens such as {@code "-1"},
   * {@code "2,"}.
   *
   * @throws knotwidth.core.GaussCodeParseException if a token is not a nonzero integer
   * @throws knotwidth.core.DiagramException if the code does not describe a searchable diagram
   */
  public static String computeWidthBound(List<String> rawCode) {
    return compute(rawCode, SearchOptions.sequential()).value();
  }

  public static String computeWidthBoundFromText(String line) {
    return compute(GaussCodeParser.parseText(line), SearchOptions.sequential()).value();
  }

  public static SearchResult compute(List<String> rawCode, SearchOptions options) {
    Objects.requireNonNull(rawCode, "rawCode");
    return compute(GaussCodeParser.parse(rawCode), options);
  }

  public static SearchResult compute(GaussCode code, SearchOptions options) {
    return new WidthSearch(options).search(buildDiagram(code));
  }

  public static KnotDiagram buildDiagram(GaussCode code) {
    Objects.requireNonNull(code, "code");
    return new CrossingGraphBuilder().build(new StrandDecomposer().decompose(code));
  }
}
