package io.sysvtz;

/** The type of error raised while parsing a recipe or resolving a local time. */
public enum ErrorKind {
  /** The recipe does not match the System V grammar. */
  INVALID_RECIPE("invalid_recipe"),
  /** The local reading falls inside a spring-forward gap. */
  NON_EXISTENT_LOCAL_TIME("non_existent_local_time");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
