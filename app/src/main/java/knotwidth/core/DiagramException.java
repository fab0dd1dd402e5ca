package knotwidth.core;

/**
 * Raised when a Gauss code does not describe a diagram the search can work on: missing
 * under-strands, degenerate strands, or too few strands to seed a search.
 */
public final class DiagramException extends KnotWidthException {

  public DiagramException(String message) {
    super(message);
  }
}
