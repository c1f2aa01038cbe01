package io.sysvtz;

import io.sysvtz.calendar.CivilCalendar;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A point on a civil time scale, as a Rata Die day number and the seconds elapsed since midnight.
 *
 * <p>Whether the pair is read as UTC or as a local clock reading depends on the caller. A
 * seconds-of-day value of 86400 is accepted to represent a leap second; queries treat it as 86399.
 *
 * @param dayNumber the Rata Die day number (0001-01-01 is day 1)
 * @param secondsOfDay the seconds since midnight, 0 to 86400
 */
public record CivilInstant(long dayNumber, int secondsOfDay) {
  /** Seconds in a civil day without a leap second. */
  public static final int SECONDS_PER_DAY = 86400;

  /** Validates the seconds-of-day range. */
  public CivilInstant {
    if (secondsOfDay < 0 || secondsOfDay > SECONDS_PER_DAY) {
      throw new IllegalArgumentException("seconds of day out of range: " + secondsOfDay);
    }
  }

  /**
   * Returns the UTC civil instant of the given instant.
   *
   * @param instant the instant
   * @return the UTC day number and seconds of day
   */
  public static CivilInstant ofInstant(Instant instant) {
    long epochSecond = instant.getEpochSecond();
    long epochDay = Math.floorDiv(epochSecond, SECONDS_PER_DAY);
    int sod = (int) Math.floorMod(epochSecond, (long) SECONDS_PER_DAY);
    return new CivilInstant(CivilCalendar.dayNumberOfEpochDay(epochDay), sod);
  }

  /**
   * Returns the civil reading of the given local date-time, ignoring fractions of a second.
   *
   * @param dateTime the local date-time
   * @return the day number and seconds of day
   */
  public static CivilInstant ofLocalDateTime(LocalDateTime dateTime) {
    return new CivilInstant(
        CivilCalendar.dayNumberOf(dateTime.toLocalDate()), dateTime.toLocalTime().toSecondOfDay());
  }

  /**
   * Returns the seconds of day with a leap second folded onto the last second of the day.
   *
   * @return the seconds of day, 0 to 86399
   */
  public int clampedSecondsOfDay() {
    return Math.min(secondsOfDay, SECONDS_PER_DAY - 1);
  }

  /**
   * Returns a civil instant shifted by the given number of seconds, carrying into the day number.
   *
   * @param seconds the shift, may be negative
   * @return the shifted civil instant
   */
  public CivilInstant plusSeconds(long seconds) {
    long total = clampedSecondsOfDay() + seconds;
    long days = Math.floorDiv(total, SECONDS_PER_DAY);
    int sod = (int) Math.floorMod(total, (long) SECONDS_PER_DAY);
    return new CivilInstant(dayNumber + days, sod);
  }

  /**
   * Returns this pair read as a local date-time.
   *
   * @return the local date-time
   */
  public LocalDateTime toLocalDateTime() {
    LocalDate date = CivilCalendar.dateOf(dayNumber);
    return LocalDateTime.of(date, LocalTime.ofSecondOfDay(clampedSecondsOfDay()));
  }

  /**
   * Returns this pair read as a UTC instant.
   *
   * @return the instant
   */
  public Instant toInstant() {
    long epochDay = CivilCalendar.epochDayOf(dayNumber);
    return Instant.ofEpochSecond(
        Math.addExact(Math.multiplyExact(epochDay, SECONDS_PER_DAY), clampedSecondsOfDay()));
  }
}
