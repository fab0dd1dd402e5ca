package knotwidth.core;

/** The two upper bounds on Gabai width available for diagrams realizing Wirtinger number four. */
public enum WidthBound {
  /** Some seed triple plus one extra strand colors the whole diagram. */
  TWENTY_EIGHT("28"),
  THIRTY_TWO("32");

  private final String value;

  WidthBound(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
