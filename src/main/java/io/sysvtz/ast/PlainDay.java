package io.sysvtz.ast;

/**
 * A day rule of the form "n": the (n+1)th day of the year, counting 29 February in leap years.
 *
 * @param day the zero-based day (0-365)
 */
public record PlainDay(int day) implements DayRule {
  /** Validates the day range. */
  public PlainDay {
    if (day < 0 || day > 365) {
      throw new IllegalArgumentException("day of year out of range: " + day);
    }
  }
}
