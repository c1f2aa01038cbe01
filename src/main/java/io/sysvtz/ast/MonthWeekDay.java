package io.sysvtz.ast;

/**
 * A day rule of the form "Mm.w.d": weekday d of week w of month m.
 *
 * <p>Week 1 holds days 1-7 of the month, week 2 days 8-14, and so on. Week 5 means the last seven
 * days of the month rather than the incomplete fifth week.
 *
 * @param month the month (1-12)
 * @param week the week (1-5)
 * @param weekday the weekday (0 = Sunday, 6 = Saturday)
 */
public record MonthWeekDay(int month, int week, int weekday) implements DayRule {
  /** The week number that selects the last seven days of the month. */
  public static final int LAST_WEEK = 5;

  /** Validates the field ranges. */
  public MonthWeekDay {
    if (month < 1 || month > 12) {
      throw new IllegalArgumentException("month out of range: " + month);
    }
    if (week < 1 || week > LAST_WEEK) {
      throw new IllegalArgumentException("week out of range: " + week);
    }
    if (weekday < 0 || weekday > 6) {
      throw new IllegalArgumentException("weekday out of range: " + weekday);
    }
  }

  /**
   * Returns whether this rule selects from the last seven days of the month.
   *
   * @return true for week 5
   */
  public boolean isLastWeek() {
    return week == LAST_WEEK;
  }
}
