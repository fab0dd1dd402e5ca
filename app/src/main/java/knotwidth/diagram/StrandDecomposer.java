package knotwidth.diagram;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import knotwidth.core.DiagramException;
import knotwidth.core.GaussCode;
import knotwidth.core.Strand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a circular Gauss code into strands.
 *
 * <p>Walks the code from its first under-pass. From each under-pass it advances over the following
 * over-passes to the next under-pass; that inclusive span is one strand, and the walk resumes from
 * the under-pass that closed it. The walk ends when a strand repeats, which for a well-formed code
 * happens once the traversal is back at its starting under-pass. Strands are indexed in the order
 * they are found.
 */
public final class StrandDecomposer {
  private static final Logger LOG = LoggerFactory.getLogger(StrandDecomposer.class);

  public List<Strand> decompose(GaussCode code) {
    Objects.requireNonNull(code, "code");
    if (code.isEmpty()) {
      throw new DiagramException("Gauss code is empty");
    }
    int start = code.firstUnderPosition();
    if (start < 0) {
      throw new DiagramException("Gauss code has no under-pass: " + code);
    }
    if (code.underPassCount() == 1) {
      throw new DiagramException(
          "Gauss code has a single under-pass, its only strand starts and ends at position "
              + start);
    }

    List<Strand> strands = new ArrayList<>();
    Set<List<Integer>> seen = new HashSet<>();
    int position = start;
    while (true) {
      int end = nextUnder(code, position);
      List<Integer> entries = code.span(position, end);
      if (!seen.add(entries)) {
        break;
      }
      strands.add(new Strand(strands.size(), position, entries));
      position = end;
    }
    LOG.debug("Decomposed {} into {} strands", code, strands.size());
    return List.copyOf(strands);
  }

  private static int nextUnder(GaussCode code, int from) {
    int position = code.next(from);
    while (!code.isUnder(position)) {
      position = code.next(position);
    }
    return position;
  }
}
