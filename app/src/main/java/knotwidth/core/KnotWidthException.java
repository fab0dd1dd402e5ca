package knotwidth.core;

/** Base type for failures raised while computing a width bound. */
public class KnotWidthException extends RuntimeException {

  public KnotWidthException(String message) {
    super(message);
  }

  public KnotWidthException(String message, Throwable cause) {
    super(message, cause);
  }
}
