package io.sysvtz.ast;

/**
 * A DST transition rule: the day it happens on and when in that day, as UTC seconds.
 *
 * <p>The trigger is the stated clock time read in the offset that prevails just before the change,
 * converted to UTC. It may fall outside 0-86399, in which case the transition lands on the previous
 * or next UTC day.
 *
 * @param dayRule the day the transition happens on
 * @param triggerSecondsOfDay the UTC seconds after the start of that day
 */
public record ChangeRule(DayRule dayRule, int triggerSecondsOfDay) {
  /**
   * Builds a change rule from a wall-clock time and the offset in force before the change.
   *
   * @param dayRule the day rule
   * @param clockSeconds the stated time of day in seconds
   * @param referenceOffset the offset east of UT before the change, in seconds
   * @return the change rule
   */
  public static ChangeRule of(DayRule dayRule, int clockSeconds, int referenceOffset) {
    return new ChangeRule(dayRule, -referenceOffset + clockSeconds);
  }

  /**
   * Returns the stated clock time of this rule, given the offset it was read in.
   *
   * @param referenceOffset the offset east of UT before the change, in seconds
   * @return the clock time in seconds
   */
  public int clockSeconds(int referenceOffset) {
    return triggerSecondsOfDay + referenceOffset;
  }
}
