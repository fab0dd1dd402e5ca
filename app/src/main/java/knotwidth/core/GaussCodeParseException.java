package knotwidth.core;

/** Raised when a Gauss code token cannot be read as a nonzero signed integer. */
public final class GaussCodeParseException extends KnotWidthException {
  private final String token;
  private final int position;

  public GaussCodeParseException(String token, int position, String message) {
    super(message);
    this.token = token;
    this.position = position;
  }

  public GaussCodeParseException(String token, int position, String message, Throwable cause) {
    super(message, cause);
    this.token = token;
    this.position = position;
  }

  public String token() {
    return token;
  }

  /** Zero-based index of the offending token in the input sequence. */
  public int position() {
    return position;
  }
}
