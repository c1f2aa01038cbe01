package io.sysvtz;

import java.util.Optional;

/** Exception thrown for invalid timezone recipes and for local times that do not exist. */
public final class TzException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span of the offending fragment, for recipe errors. */
  private final Span span;

  /** The recipe string being parsed, or the zone name for local-time errors. */
  private final String input;

  /** The local reading that could not be resolved. */
  private final CivilInstant localTime;

  /** The problem with the fragment, without the recipe prefix. */
  private final String detail;

  private TzException(
      ErrorKind kind,
      String message,
      String detail,
      Span span,
      String input,
      CivilInstant localTime) {
    super(message);
    this.kind = kind;
    this.detail = detail;
    this.span = span;
    this.input = input;
    this.localTime = localTime;
  }

  /**
   * Creates a new invalid-recipe error.
   *
   * @param message what was wrong with the offending fragment
   * @param span the location of the fragment in the recipe
   * @param recipe the whole recipe string
   * @return a new TzException for an invalid recipe
   */
  public static TzException invalidRecipe(String message, Span span, String recipe) {
    return new TzException(
        ErrorKind.INVALID_RECIPE,
        "not a valid SysV-style timezone specification \"" + recipe + "\": " + message,
        message,
        span,
        recipe,
        null);
  }

  /**
   * Creates a new non-existent local time error.
   *
   * @param localTime the local reading that falls in a gap
   * @param zoneName the name of the zone the reading was interpreted in
   * @return a new TzException for a non-existent local time
   */
  public static TzException nonExistentLocalTime(CivilInstant localTime, String zoneName) {
    return new TzException(
        ErrorKind.NON_EXISTENT_LOCAL_TIME,
        "non-existent local time "
            + localTime.toLocalDateTime()
            + " in "
            + zoneName
            + " due to offset change",
        null,
        null,
        zoneName,
        localTime);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span of the offending recipe fragment, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the recipe for parse errors, or the zone name for local-time errors.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the offending recipe fragment, if available.
   *
   * @return the fragment text, or empty if not available
   */
  public Optional<String> fragment() {
    if (span == null || input == null) {
      return Optional.empty();
    }
    int start = Math.min(span.start(), input.length());
    int end = Math.min(Math.max(span.end(), start), input.length());
    return Optional.of(input.substring(start, end));
  }

  /**
   * Returns the local reading that could not be resolved, if available.
   *
   * @return the local reading, or empty if not available
   */
  public Optional<CivilInstant> localTime() {
    return Optional.ofNullable(localTime);
  }

  /**
   * Formats a rich error message with the offending fragment underlined.
   *
   * <p>For recipe errors produces output like:
   *
   * <pre>
   * error: hour out of range
   *   EST25EDT
   *      ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.INVALID_RECIPE && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(detail).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
