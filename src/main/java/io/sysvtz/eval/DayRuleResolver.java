package io.sysvtz.eval;

import io.sysvtz.ast.DayRule;
import io.sysvtz.ast.JulianDay;
import io.sysvtz.ast.MonthWeekDay;
import io.sysvtz.ast.PlainDay;
import io.sysvtz.calendar.CivilCalendar;

/**
 * Resolves a day rule to a day of a particular year.
 *
 * <p>Days of the year are 1-based. A {@link PlainDay} of 365 resolves to day 366, which in a
 * non-leap year is 1 January of the following year; callers only use the result as an offset from
 * the start of the year, so that carries over naturally.
 */
public final class DayRuleResolver {
  private DayRuleResolver() {}

  /**
   * Returns the day of the year the rule selects.
   *
   * @param rule the day rule
   * @param year the year
   * @return the 1-based day of the year
   */
  public static int resolve(DayRule rule, int year) {
    if (rule instanceof JulianDay julian) {
      return resolveJulian(julian.day(), year);
    }
    if (rule instanceof PlainDay plain) {
      return plain.day() + 1;
    }
    if (rule instanceof MonthWeekDay mwd) {
      return resolveMonthWeekDay(mwd, year);
    }
    throw new IllegalStateException("internal error: unrecognised day rule " + rule);
  }

  /** Days 1-59 are January and February; later days skip 29 February in leap years. */
  private static int resolveJulian(int day, int year) {
    if (day < 60) {
      return day;
    }
    return CivilCalendar.yearLength(year) - 365 + day;
  }

  private static int resolveMonthWeekDay(MonthWeekDay rule, int year) {
    int firstDayOfWeek =
        rule.isLastWeek()
            ? CivilCalendar.daysInMonth(year, rule.month()) - 6
            : (rule.week() - 1) * 7 + 1;
    int firstWeekday = CivilCalendar.weekdayOf(year, rule.month(), firstDayOfWeek);
    int dayOfMonth = firstDayOfWeek + (rule.weekday() + 7 - firstWeekday) % 7;
    return CivilCalendar.dateToDayOfYear(year, rule.month(), dayOfMonth);
  }
}
