package io.sysvtz;

/**
 * Represents a range of character positions in a recipe string.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span, at least 1
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns a span covering both this span and the other.
   *
   * @param other the span to merge with
   * @return the covering span
   */
  public Span to(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }
}
