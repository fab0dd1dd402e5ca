package knotwidth.search;

import java.util.Objects;
import knotwidth.core.KnotDiagram;
import knotwidth.core.WidthBound;

/** Outcome of a width search over one diagram. */
public record SearchResult(KnotDiagram diagram, WidthBound bound, SearchRun run) {

  public SearchResult {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(bound, "bound");
    Objects.requireNonNull(run, "run");
  }

  public String value() {
    return bound.value();
  }
}
