package io.sysvtz.ast;

/**
 * A day rule of the form "Jn": the nth day of a non-leap year, so "J59" is always 28 February and
 * "J60" is always 1 March.
 *
 * @param day the day (1-365)
 */
public record JulianDay(int day) implements DayRule {
  /** Validates the day range. */
  public JulianDay {
    if (day < 1 || day > 365) {
      throw new IllegalArgumentException("julian day out of range: " + day);
    }
  }
}
