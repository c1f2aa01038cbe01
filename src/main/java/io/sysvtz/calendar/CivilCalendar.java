package io.sysvtz.calendar;

import java.time.LocalDate;
import java.time.Year;

/**
 * Proleptic Gregorian calendar arithmetic over Rata Die day numbers.
 *
 * <p>Day 1 is 0001-01-01. Days of the year are 1-based (1 January is day 1) and weekdays run from
 * 0 (Sunday) to 6 (Saturday), the numbering the recipe day rules use.
 */
public final class CivilCalendar {
  /** Rata Die day number of the Java epoch day 0 (1970-01-01). */
  public static final long EPOCH_DAY_SHIFT = 719163L;

  private CivilCalendar() {}

  /**
   * Returns the number of days in the year.
   *
   * @param year the year
   * @return 365 or 366
   */
  public static int yearLength(int year) {
    return Year.isLeap(year) ? 366 : 365;
  }

  /**
   * Returns the number of days in the month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the month length
   */
  public static int daysInMonth(int year, int month) {
    return LocalDate.of(year, month, 1).lengthOfMonth();
  }

  /**
   * Returns the 1-based day of the year of a date.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the day of the year
   */
  public static int dateToDayOfYear(int year, int month, int day) {
    return LocalDate.of(year, month, day).getDayOfYear();
  }

  /**
   * Returns the weekday of a date, with Sunday as 0.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the weekday (0-6)
   */
  public static int weekdayOf(int year, int month, int day) {
    return LocalDate.of(year, month, day).getDayOfWeek().getValue() % 7;
  }

  /**
   * Returns the date of a day number.
   *
   * @param dayNumber the Rata Die day number
   * @return the date
   */
  public static LocalDate dateOf(long dayNumber) {
    return LocalDate.ofEpochDay(epochDayOf(dayNumber));
  }

  /**
   * Returns the day number of a date.
   *
   * @param date the date
   * @return the Rata Die day number
   */
  public static long dayNumberOf(LocalDate date) {
    return dayNumberOfEpochDay(date.toEpochDay());
  }

  /**
   * Returns the day number of the first day of the year.
   *
   * @param year the year
   * @return the Rata Die day number of 1 January
   */
  public static long yearStart(int year) {
    return dayNumberOf(LocalDate.of(year, 1, 1));
  }

  /**
   * Converts a Java epoch day to a day number.
   *
   * @param epochDay days since 1970-01-01
   * @return the Rata Die day number
   */
  public static long dayNumberOfEpochDay(long epochDay) {
    return Math.addExact(epochDay, EPOCH_DAY_SHIFT);
  }

  /**
   * Converts a day number to a Java epoch day.
   *
   * @param dayNumber the Rata Die day number
   * @return days since 1970-01-01
   */
  public static long epochDayOf(long dayNumber) {
    return Math.subtractExact(dayNumber, EPOCH_DAY_SHIFT);
  }
}
