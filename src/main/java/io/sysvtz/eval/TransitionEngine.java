package io.sysvtz.eval;

import io.sysvtz.CivilInstant;
import io.sysvtz.ast.ChangeRule;
import io.sysvtz.ast.DstRules;
import io.sysvtz.ast.TimezoneDescriptor;
import io.sysvtz.calendar.CivilCalendar;
import java.time.LocalDate;

/**
 * Decides whether DST is in effect at a UTC instant.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The instant is expressed as seconds since the start of its year. For each of the end rule and
 * the start rule, the most recent transition at or before the instant is found by trying next
 * year's transition, then this year's, then earlier years', until one is not in the future. DST is
 * in effect iff the most recent start is later than the most recent end.
 *
 * <p>Trying next year first covers rules whose trigger time pushes a late-December transition
 * into the following UTC year. Going backwards covers instants that precede this year's
 * transition of a kind.
 *
 * <h2>Search bound</h2>
 *
 * <p>A well-formed rule converges within three years. The search gives up after {@link
 * #MAX_YEAR_SEARCH} years and reports an internal error instead of looping.
 */
public final class TransitionEngine {
  /** Maximum number of years the backward search may visit. */
  static final int MAX_YEAR_SEARCH = 400;

  private static final long SECONDS_PER_DAY = CivilInstant.SECONDS_PER_DAY;

  private TransitionEngine() {}

  /**
   * Returns whether DST is in effect at the given UTC instant.
   *
   * @param descriptor the timezone
   * @param utc the UTC day number and seconds of day
   * @return true if DST is in effect; always false for a fixed-offset zone
   */
  public static boolean isDstActive(TimezoneDescriptor descriptor, CivilInstant utc) {
    DstRules dst = descriptor.dst();
    if (dst == null) {
      return false;
    }
    return isDstActive(dst, utc.dayNumber(), utc.clampedSecondsOfDay());
  }

  /**
   * Returns the offset in effect at the given UTC instant.
   *
   * @param descriptor the timezone
   * @param utc the UTC day number and seconds of day
   * @return the offset east of UT, in seconds
   */
  public static int offsetFor(TimezoneDescriptor descriptor, CivilInstant utc) {
    return isDstActive(descriptor, utc)
        ? descriptor.dst().offsetSeconds()
        : descriptor.stdOffsetSeconds();
  }

  /**
   * Returns the abbreviation in effect at the given UTC instant.
   *
   * @param descriptor the timezone
   * @param utc the UTC day number and seconds of day
   * @return the standard or DST abbreviation
   */
  public static String abbreviationFor(TimezoneDescriptor descriptor, CivilInstant utc) {
    return isDstActive(descriptor, utc)
        ? descriptor.dst().abbreviation()
        : descriptor.stdAbbreviation();
  }

  /**
   * Returns the UTC instant at which a rule fires in the given year.
   *
   * <p>The result may fall in the neighbouring UTC year when the trigger time is far enough from
   * midnight.
   *
   * @param rule the change rule
   * @param year the year whose day rule is resolved
   * @return the UTC instant of the transition
   */
  public static CivilInstant transitionIn(ChangeRule rule, int year) {
    int dayOfYear = DayRuleResolver.resolve(rule.dayRule(), year);
    CivilInstant midnight = new CivilInstant(CivilCalendar.yearStart(year) + dayOfYear - 1, 0);
    return midnight.plusSeconds(rule.triggerSecondsOfDay());
  }

  static boolean isDstActive(DstRules dst, long dayNumber, int secondsOfDay) {
    LocalDate date = CivilCalendar.dateOf(dayNumber);
    int year = date.getYear();
    long secondsOfYear = date.getDayOfYear() * SECONDS_PER_DAY + secondsOfDay;

    long latestEnd = latestTransition(dst.endRule(), year, secondsOfYear);
    long latestStart = latestTransition(dst.startRule(), year, secondsOfYear);
    return latestStart > latestEnd;
  }

  /**
   * Finds the latest firing of the rule at or before the given moment, in seconds relative to the
   * start of {@code year} (negative for earlier years).
   */
  private static long latestTransition(ChangeRule rule, int year, long secondsOfYear) {
    int y = year + 1;
    long dayOffset = CivilCalendar.yearLength(year);
    for (int i = 0; i < MAX_YEAR_SEARCH; i++) {
      long changeSeconds =
          (dayOffset + DayRuleResolver.resolve(rule.dayRule(), y)) * SECONDS_PER_DAY
              + rule.triggerSecondsOfDay();
      if (changeSeconds <= secondsOfYear) {
        return changeSeconds;
      }
      y--;
      dayOffset -= CivilCalendar.yearLength(y);
    }
    throw new IllegalStateException(
        "internal error: no transition for "
            + rule
            + " within "
            + MAX_YEAR_SEARCH
            + " years before "
            + year);
  }
}
